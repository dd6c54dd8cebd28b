package com.todoinsight.server;

import com.todoinsight.server.error.TodoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.NestedExceptionUtils;

/**
 * 类说明 / Class Description:
 * 中文：待办服务启动入口，装配持久化、路由、请求计数与指标端点。
 * English: Entry point of the todo service, wiring persistence, routes, request counting and the metrics endpoint.
 *
 * 使用场景 / Use Cases:
 * 中文：持久化初始化成功后才监听端口；初始化失败则记录错误并以非零状态码退出，不做重试。
 * English: The port is bound only after persistence initialization succeeds; on failure the error is
 * logged and the process exits with a non-zero status, without retrying.
 */
@SpringBootApplication(scanBasePackages = "com.todoinsight")
public class TodoServerApplication {

    private static final Logger log = LoggerFactory.getLogger(TodoServerApplication.class);

    public static void main(String[] args) {
        try {
            SpringApplication.run(TodoServerApplication.class, args);
        } catch (Exception ex) {
            // the stack trace is already logged by SpringApplication
            log.error("Todo server failed to start: {}", startupFailureSummary(ex));
            System.exit(1);
        }
    }

    // the domain failure if there is one, else the innermost cause, on a single line
    static String startupFailureSummary(Throwable failure) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(failure);
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof TodoException) {
                cause = current;
                break;
            }
        }
        String message = cause.getMessage() == null ? "" : cause.getMessage().lines().findFirst().orElse("");
        return message.isBlank()
                ? cause.getClass().getName()
                : cause.getClass().getSimpleName() + ": " + message;
    }
}
