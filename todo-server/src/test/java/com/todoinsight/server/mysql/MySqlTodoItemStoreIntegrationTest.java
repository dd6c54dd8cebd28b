package com.todoinsight.server.mysql;

import com.todoinsight.server.error.ItemNotFoundException;
import com.todoinsight.server.persistence.ItemChanges;
import com.todoinsight.server.persistence.TodoItem;
import com.todoinsight.server.persistence.TodoItemRepository;
import com.todoinsight.server.persistence.TodoItemStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 测试目标：在真实 MySQL 上验证建表与条目增删改查。
 * 说明：用新的 JDBC 连接回读，确认写入已提交。
 */
class MySqlTodoItemStoreIntegrationTest extends AbstractMySqlIntegrationTest {

    @Autowired
    private TodoItemStore store;

    @Autowired
    private TodoItemRepository repository;

    @Autowired
    private DataSource dataSource;

    @BeforeEach
    void setUp() {
        repository.deleteAllInBatch();
    }

    @Test
    void initCreatesTodoItemsTable() {
        JdbcTemplate template = new JdbcTemplate(dataSource);

        Integer tables = template.queryForObject(
                "select count(*) from information_schema.tables where table_schema = database() and table_name = 'todo_items'",
                Integer.class);

        assertThat(tables).isEqualTo(1);
    }

    @Test
    void committedItemIsVisibleFromNewConnection() {
        TodoItem created = store.addItem("buy milk");
        store.updateItem(created.getId(), new ItemChanges(null, true));

        JdbcTemplate template = new JdbcTemplate(dataSource);
        Boolean completed = template.queryForObject(
                "select completed from todo_items where id = ?", Boolean.class, created.getId());

        assertThat(completed).isTrue();
    }

    @Test
    void listingKeepsInsertionOrder() {
        TodoItem first = store.addItem("first");
        TodoItem second = store.addItem("second");

        assertThat(store.listItems()).extracting(TodoItem::getId).containsExactly(first.getId(), second.getId());
    }

    @Test
    void deleteUnknownItemFails() {
        assertThatThrownBy(() -> store.deleteItem("missing-id")).isInstanceOf(ItemNotFoundException.class);
    }
}
