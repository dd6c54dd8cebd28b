package com.todoinsight.server.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum TodoErrorCode implements ErrorCode {
    // client errors
    INVALID_ITEM_PAYLOAD("T001", "Malformed item payload: %s", HttpStatus.BAD_REQUEST),
    ITEM_NOT_FOUND("T002", "Item not found (id: %s)", HttpStatus.NOT_FOUND),
    // the status of the rejection travels with the response, not with the code
    REQUEST_REJECTED("T003", "Request rejected: %s", HttpStatus.BAD_REQUEST),

    // server errors
    PERSISTENCE_FAILURE("S001", "Persistence operation failed", HttpStatus.INTERNAL_SERVER_ERROR),
    PERSISTENCE_UNAVAILABLE("S002", "Unable to initialize persistence: %s", HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_SERVER_ERROR("S003", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;
}
