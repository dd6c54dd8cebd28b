package com.todoinsight.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 类说明 / Class Description:
 * 中文：待办服务的数据库连接设置，绑定 todo.database.*，兼容 MYSQL_* 环境变量及其 *_FILE 密钥文件写法。
 * English: Database settings for the todo service bound to todo.database.*, compatible with the MYSQL_*
 * environment variables and their *_FILE secret-file variants.
 *
 * 使用场景 / Use Cases:
 * 中文：容器部署时通过 Docker secrets 注入口令；未配置 MySQL 主机时回落到内嵌 H2 文件库。
 * English: Inject credentials through Docker secrets in container deployments; fall back to an embedded
 * H2 file database when no MySQL host is configured.
 */
@Getter
@Setter
@ConfigurationProperties("todo.database")
public class TodoDatabaseProperties {

    private String host;
    private String hostFile;
    private int port = 3306;
    private String user;
    private String userFile;
    private String password;
    private String passwordFile;
    private String name;
    private String nameFile;

    /** Used when no MySQL host is configured. */
    private String embeddedUrl = "jdbc:h2:file:/etc/todos/todo;MODE=MySQL;DB_CLOSE_ON_EXIT=FALSE";

    public String resolveHost() {
        return resolve(host, hostFile);
    }

    public String resolveUser() {
        return resolve(user, userFile);
    }

    public String resolvePassword() {
        return resolve(password, passwordFile);
    }

    public String resolveName() {
        return resolve(name, nameFile);
    }

    public boolean isMySqlConfigured() {
        String resolved = resolveHost();
        return resolved != null && !resolved.isBlank();
    }

    public String mysqlJdbcUrl() {
        return "jdbc:mysql://" + resolveHost() + ":" + port + "/" + resolveName() + "?characterEncoding=UTF-8";
    }

    /**
     * 方法说明 / Method Description:
     * 中文：优先读取 *_FILE 指向的文件内容（去掉首尾空白），否则返回普通变量值。
     * English: Prefer the content of the file named by the *_FILE setting (surrounding whitespace stripped),
     * otherwise return the plain value.
     *
     * 异常 / Exceptions:
     * 中文/英文：文件不可读时抛出 IllegalStateException
     */
    private static String resolve(String value, String file) {
        if (file == null || file.isBlank()) {
            return value;
        }
        try {
            return Files.readString(Path.of(file), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read database setting from " + file, e);
        }
    }
}
