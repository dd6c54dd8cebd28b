package com.todoinsight.server.error.dto;

import com.todoinsight.server.error.ErrorCode;
import com.todoinsight.server.error.TodoException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

    /**
     * 领域异常：使用异常中已格式化的消息（例如包含缺失的 id）。
     */
    public static ResponseEntity<ErrorResponse> toResponseEntity(TodoException e) {
        return toResponseEntity(e.getErrorCode(), e.getMessage());
    }

    /**
     * 未预期的系统异常：只返回错误码的默认消息，不暴露内部细节。
     */
    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return toResponseEntity(errorCode, errorCode.getMessage());
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String message) {
        return ResponseEntity
                .status(errorCode.getStatus())
                .body(of(errorCode, message));
    }

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return of(errorCode.getStatus(), errorCode, message);
    }

    /**
     * 框架层拒绝（405、415 等）：状态码取自实际响应，错误码统一。
     */
    public static ErrorResponse of(HttpStatusCode status, ErrorCode errorCode, String message) {
        return new ErrorResponse(status.value(), errorCode.getCode(), message, LocalDateTime.now());
    }
}
