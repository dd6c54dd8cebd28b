package com.todoinsight.server.web.dto;

import com.todoinsight.server.persistence.TodoItem;

public record ItemResponse(String id, String description, boolean completed) {

    public static ItemResponse from(TodoItem item) {
        return new ItemResponse(item.getId(), item.getDescription(), item.isCompleted());
    }
}
