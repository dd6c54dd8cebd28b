package com.todoinsight.server.mysql;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * 测试基类目标：为待办服务提供容器化的真实 MySQL。
 * 说明：通过 todo.database.* 指向容器，走与生产相同的 MySQL 分支；无 Docker 时整体跳过。
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@ActiveProfiles("test")
public abstract class AbstractMySqlIntegrationTest {

    private static final MySQLContainer<?> MYSQL_CONTAINER = new MySQLContainer<>("mysql:8.3.0")
            .withDatabaseName("todos")
            .withUsername("todo_user")
            .withPassword("todo_pass");

    @BeforeAll
    static void startContainer() {
        MYSQL_CONTAINER.start();
    }

    @AfterAll
    static void stopContainer() {
        MYSQL_CONTAINER.stop();
    }

    @DynamicPropertySource
    static void overrideDatabaseProperties(DynamicPropertyRegistry registry) {
        registry.add("todo.database.host", MYSQL_CONTAINER::getHost);
        registry.add("todo.database.port", () -> MYSQL_CONTAINER.getMappedPort(MySQLContainer.MYSQL_PORT));
        registry.add("todo.database.user", MYSQL_CONTAINER::getUsername);
        registry.add("todo.database.password", MYSQL_CONTAINER::getPassword);
        registry.add("todo.database.name", MYSQL_CONTAINER::getDatabaseName);
    }
}
