package com.todoinsight.server.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.todoinsight.server.persistence.ItemChanges;

/**
 * Body of {@code PUT /api/items/{id}}; absent fields stay unchanged.
 */
public record UpdateItemRequest(@JsonAlias("name") String description, Boolean completed) {

    public ItemChanges toChanges() {
        return new ItemChanges(description, completed);
    }
}
