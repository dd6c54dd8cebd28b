package com.todoinsight.server.error;

import org.springframework.http.HttpStatus;

/**
 * 错误种类约束接口：每种错误对应一个业务码、消息模板与 HTTP 状态码。
 */
public interface ErrorCode {

    String getCode();

    /** 消息模板，可包含 String.format 占位符。 */
    String getMessage();

    HttpStatus getStatus();
}
