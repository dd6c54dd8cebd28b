package com.todoinsight.server.persistence;

/**
 * Partial update of an item; {@code null} leaves the field untouched.
 */
public record ItemChanges(String description, Boolean completed) {

    public boolean isEmpty() {
        return description == null && completed == null;
    }
}
