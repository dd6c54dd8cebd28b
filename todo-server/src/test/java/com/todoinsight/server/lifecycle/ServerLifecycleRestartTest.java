package com.todoinsight.server.lifecycle;

import com.todoinsight.server.TodoServerApplication;
import com.todoinsight.server.persistence.TodoItem;
import com.todoinsight.server.persistence.TodoItemStore;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 测试目标：上下文关闭（关闭钩子或开发期热重启）经 stop() 进入 STOPPED 并释放连接池；重启后重新初始化持久化。
 * 说明：热重启即关闭旧上下文后以同样参数再次 run，这里直接按此顺序驱动。
 */
class ServerLifecycleRestartTest {

    private static final String EMBEDDED_URL = "jdbc:h2:mem:lifecycle-restart;MODE=MySQL;DB_CLOSE_DELAY=-1";

    @Test
    void closingContextDrainsThroughStop() {
        ConfigurableApplicationContext context = launch();
        ServerLifecycleController controller = context.getBean(ServerLifecycleController.class);
        DataSource dataSource = context.getBean(DataSource.class);
        assertThat(controller.isRunning()).isTrue();

        context.close();

        assertThat(controller.currentState()).isEqualTo(ServerState.STOPPED);
        assertThat(controller.isRunning()).isFalse();
        assertThat(dataSource).isInstanceOf(HikariDataSource.class);
        assertThat(((HikariDataSource) dataSource).isClosed()).isTrue();
    }

    @Test
    void restartInitializesPersistenceAgain() {
        ConfigurableApplicationContext first = launch();
        String id = first.getBean(TodoItemStore.class).addItem("survives restart").getId();
        ServerLifecycleController firstController = first.getBean(ServerLifecycleController.class);
        first.close();

        ConfigurableApplicationContext second = launch();
        try {
            ServerLifecycleController secondController = second.getBean(ServerLifecycleController.class);
            assertThat(firstController.currentState()).isEqualTo(ServerState.STOPPED);
            assertThat(secondController).isNotSameAs(firstController);
            assertThat(secondController.isRunning()).isTrue();
            assertThat(secondController.currentState()).isEqualTo(ServerState.STARTING);

            TodoItem reloaded = second.getBean(TodoItemStore.class).getItem(id);
            assertThat(reloaded.getDescription()).isEqualTo("survives restart");
        } finally {
            second.close();
        }
    }

    private static ConfigurableApplicationContext launch() {
        return new SpringApplicationBuilder(TodoServerApplication.class)
                .web(WebApplicationType.NONE)
                .profiles("test")
                .run("--todo.database.embedded-url=" + EMBEDDED_URL);
    }
}
