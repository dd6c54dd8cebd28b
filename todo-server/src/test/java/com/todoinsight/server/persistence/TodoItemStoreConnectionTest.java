package com.todoinsight.server.persistence;

import com.todoinsight.server.error.PersistenceInitializationException;
import com.todoinsight.server.error.TodoErrorCode;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 测试目标：验证 init() 在数据库不可达时抛出连接错误，teardown() 在关闭失败时吞掉异常。
 */
class TodoItemStoreConnectionTest {

    private final TodoItemRepository repository = mock(TodoItemRepository.class);

    @Test
    void initFailsWhenDatabaseIsUnreachable() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));
        TodoItemStore store = new TodoItemStore(repository, dataSource);

        assertThatThrownBy(store::init)
                .isInstanceOf(PersistenceInitializationException.class)
                .hasMessageContaining("Connection refused")
                .hasCauseInstanceOf(SQLException.class)
                .satisfies(e -> assertThat(((PersistenceInitializationException) e).getErrorCode())
                        .isEqualTo(TodoErrorCode.PERSISTENCE_UNAVAILABLE));
    }

    @Test
    void initFailsWhenConnectionIsNotValid() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(false);
        TodoItemStore store = new TodoItemStore(repository, dataSource);

        assertThatThrownBy(store::init)
                .isInstanceOf(PersistenceInitializationException.class)
                .hasMessageContaining("not valid");
        verify(connection).close();
    }

    @Test
    void teardownClosesThePool() {
        HikariDataSource dataSource = mock(HikariDataSource.class);
        TodoItemStore store = new TodoItemStore(repository, dataSource);

        store.teardown();

        verify(dataSource).close();
    }

    @Test
    void teardownSwallowsCloseFailures() {
        HikariDataSource dataSource = mock(HikariDataSource.class);
        doThrow(new IllegalStateException("pool already broken")).when(dataSource).close();
        TodoItemStore store = new TodoItemStore(repository, dataSource);

        assertThatCode(store::teardown).doesNotThrowAnyException();
        verify(dataSource).close();
    }

    @Test
    void teardownIgnoresNonCloseableDataSource() {
        TodoItemStore store = new TodoItemStore(repository, mock(DataSource.class));

        assertThatCode(store::teardown).doesNotThrowAnyException();
    }
}
