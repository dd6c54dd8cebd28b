package com.todoinsight.server.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TodoItemRepository extends JpaRepository<TodoItem, String> {

    List<TodoItem> findAllByOrderByCreatedAtAscIdAsc();
}
