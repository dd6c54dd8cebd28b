package com.todoinsight.server.error;

import com.todoinsight.server.error.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * 类说明 / Class Description:
 * 中文：错误到 HTTP 状态码的集中翻译层，每种 ErrorCode 对应一个状态码与统一的 JSON 错误体。
 * English: Central translation layer from error kinds to HTTP status codes with a uniform JSON error body.
 *
 * 设计目的 / Design Purpose:
 * 中文：Spring MVC 自身的异常（未知静态资源、不支持的方法等）沿用父类给出的标准状态码与响应头，响应体改写为统一错误体。
 * English: Spring MVC's own exceptions (missing static resource, unsupported method, ...) keep the
 * standard status and headers chosen by the parent class, with the body rewritten into the uniform error body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(TodoException.class)
    protected ResponseEntity<ErrorResponse> handleTodoException(TodoException e) {
        if (e.getErrorCode().getStatus().is5xxServerError()) {
            log.error("Request failed: {} | {}", e.getErrorCode().getCode(), e.getMessage(), e);
        } else {
            log.warn("Request rejected: {} | {}", e.getErrorCode().getCode(), e.getMessage());
        }
        return ErrorResponse.toResponseEntity(e);
    }

    @ExceptionHandler(DataAccessException.class)
    protected ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        log.error("Persistence failure while handling request", e);
        return ErrorResponse.toResponseEntity(TodoErrorCode.PERSISTENCE_FAILURE);
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected failure while handling request", e);
        return ErrorResponse.toResponseEntity(TodoErrorCode.INTERNAL_SERVER_ERROR);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
                                                                  HttpHeaders headers,
                                                                  HttpStatusCode status,
                                                                  WebRequest request) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        TodoErrorCode errorCode = TodoErrorCode.INVALID_ITEM_PAYLOAD;
        return ResponseEntity.status(errorCode.getStatus())
                .body(ErrorResponse.of(errorCode, String.format(errorCode.getMessage(), "request body is not valid JSON")));
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex,
                                                             @Nullable Object body,
                                                             HttpHeaders headers,
                                                             HttpStatusCode statusCode,
                                                             WebRequest request) {
        ResponseEntity<Object> standard = super.handleExceptionInternal(ex, body, headers, statusCode, request);
        if (standard == null) {
            // response already committed
            return null;
        }
        String detail = standard.getBody() instanceof ProblemDetail problemDetail && problemDetail.getDetail() != null
                ? problemDetail.getDetail()
                : ex.getMessage();
        if (statusCode.is5xxServerError()) {
            log.error("Request failed in MVC: {} | {}", statusCode.value(), detail, ex);
        } else {
            log.warn("Request rejected by MVC: {} | {}", statusCode.value(), detail);
        }
        TodoErrorCode errorCode = TodoErrorCode.REQUEST_REJECTED;
        return ResponseEntity.status(standard.getStatusCode())
                .headers(standard.getHeaders())
                .contentType(MediaType.APPLICATION_JSON)
                .body(ErrorResponse.of(standard.getStatusCode(), errorCode, String.format(errorCode.getMessage(), detail)));
    }
}
