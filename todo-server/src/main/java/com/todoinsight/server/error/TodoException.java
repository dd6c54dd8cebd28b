package com.todoinsight.server.error;

import java.util.Objects;

/**
 * Base of every domain exception; the carried {@link ErrorCode} decides the HTTP status.
 */
public abstract class TodoException extends RuntimeException {

    private final ErrorCode errorCode;

    protected TodoException(ErrorCode errorCode, Object... args) {
        super(String.format(errorCode.getMessage(), args));
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    protected TodoException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(String.format(errorCode.getMessage(), args), cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
