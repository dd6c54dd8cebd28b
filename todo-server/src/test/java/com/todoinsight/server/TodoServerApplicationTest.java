package com.todoinsight.server;

import com.todoinsight.server.error.PersistenceInitializationException;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContextException;

import java.net.ConnectException;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 测试目标：启动失败时入口只输出一行摘要，优先给出持久化初始化错误。
 */
class TodoServerApplicationTest {

    @Test
    void summaryNamesPersistenceFailure() {
        SQLException sqlFailure = new SQLException("Communications link failure", new ConnectException("Connection refused"));
        Exception failure = new ApplicationContextException("Failed to start bean 'serverLifecycleController'",
                new PersistenceInitializationException(sqlFailure.getMessage(), sqlFailure));

        String summary = TodoServerApplication.startupFailureSummary(failure);

        assertThat(summary)
                .isEqualTo("PersistenceInitializationException: Unable to initialize persistence: Communications link failure")
                .doesNotContain("\n");
    }

    @Test
    void summaryFallsBackToInnermostCauseOnOneLine() {
        Exception failure = new IllegalStateException("outer",
                new IllegalArgumentException("first line\nsecond line"));

        assertThat(TodoServerApplication.startupFailureSummary(failure))
                .isEqualTo("IllegalArgumentException: first line");
    }

    @Test
    void summaryUsesTypeWhenMessageIsMissing() {
        assertThat(TodoServerApplication.startupFailureSummary(new IllegalStateException()))
                .isEqualTo("java.lang.IllegalStateException");
    }
}
