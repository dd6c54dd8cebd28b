package com.todoinsight.server.error;

/**
 * Raised when the backing store cannot be reached or its schema cannot be ensured at startup.
 * Fatal: the server never starts listening.
 */
public class PersistenceInitializationException extends TodoException {

    public PersistenceInitializationException(String detail) {
        super(TodoErrorCode.PERSISTENCE_UNAVAILABLE, detail);
    }

    public PersistenceInitializationException(String detail, Throwable cause) {
        super(TodoErrorCode.PERSISTENCE_UNAVAILABLE, cause, detail);
    }
}
