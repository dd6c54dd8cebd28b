package com.todoinsight.server.persistence;

import com.todoinsight.server.error.ItemNotFoundException;
import com.todoinsight.server.error.PersistenceInitializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 类说明 / Class Description:
 * 中文：待办事项持久化模块，持有共享连接池，负责连接的建立与释放以及条目的增删改查。
 * English: Persistence module of the todo service: owns the shared pool, establishes and releases the
 * connection, and serves item CRUD.
 *
 * 设计目的 / Design Purpose:
 * 中文：init() 是启动期唯一的连接点；teardown() 尽力而为，失败只记录不抛出。
 * English: init() is the single connection point at startup; teardown() is best-effort and never throws.
 */
@Service
@Transactional(readOnly = true)
public class TodoItemStore {

    private static final Logger log = LoggerFactory.getLogger(TodoItemStore.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    static final String CREATE_TABLE_SQL = "CREATE TABLE IF NOT EXISTS todo_items ("
            + "id VARCHAR(36) NOT NULL, "
            + "description VARCHAR(" + TodoItem.MAX_DESCRIPTION_LENGTH + ") NOT NULL, "
            + "completed BOOLEAN NOT NULL, "
            + "created_at DATETIME(6) NOT NULL, "
            + "PRIMARY KEY (id))";

    private final TodoItemRepository repository;
    private final DataSource dataSource;
    private final AtomicReference<LocalDateTime> lastCreatedAt = new AtomicReference<>(LocalDateTime.MIN);

    public TodoItemStore(TodoItemRepository repository, DataSource dataSource) {
        this.repository = repository;
        this.dataSource = dataSource;
    }

    /**
     * 方法说明 / Method Description:
     * 中文：建立数据库连接并确保 todo_items 表存在。
     * English: Connect to the database and ensure the todo_items table exists.
     *
     * 异常 / Exceptions:
     * 中文/英文：数据库不可达或建表失败时抛出 PersistenceInitializationException
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void init() {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                throw new PersistenceInitializationException("database connection is not valid");
            }
            try (Statement statement = connection.createStatement()) {
                statement.execute(CREATE_TABLE_SQL);
            }
            log.info("Connected to {} and ensured table todo_items", connection.getMetaData().getURL());
        } catch (SQLException e) {
            throw new PersistenceInitializationException(e.getMessage(), e);
        }
    }

    /**
     * Closes the pool. Failures are logged and swallowed so shutdown always proceeds.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void teardown() {
        if (!(dataSource instanceof AutoCloseable closeable)) {
            log.debug("DataSource {} is not closeable, nothing to tear down", dataSource.getClass().getName());
            return;
        }
        try {
            closeable.close();
            log.info("Database connection pool closed");
        } catch (Exception e) {
            log.warn("Ignoring failure while closing the database connection pool", e);
        }
    }

    public List<TodoItem> listItems() {
        return repository.findAllByOrderByCreatedAtAscIdAsc();
    }

    public TodoItem getItem(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new ItemNotFoundException(id));
    }

    @Transactional
    public TodoItem addItem(String description) {
        Objects.requireNonNull(description, "description must not be null");
        TodoItem item = new TodoItem(UUID.randomUUID().toString(), description, nextCreatedAt());
        return repository.save(item);
    }

    @Transactional
    public TodoItem updateItem(String id, ItemChanges changes) {
        TodoItem item = getItem(id);
        if (!changes.isEmpty()) {
            item.apply(changes);
        }
        return item;
    }

    @Transactional
    public void deleteItem(String id) {
        if (!repository.existsById(id)) {
            throw new ItemNotFoundException(id);
        }
        repository.deleteById(id);
    }

    // strictly increasing within the process, at the column's microsecond precision
    private LocalDateTime nextCreatedAt() {
        return lastCreatedAt.updateAndGet(last -> {
            LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.MICROS);
            return now.isAfter(last) ? now : last.plus(1, ChronoUnit.MICROS);
        });
    }
}
