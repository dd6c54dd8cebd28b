package com.todoinsight.server.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Body of {@code POST /api/items}; {@code name} is accepted as an alias of {@code description}.
 */
public record CreateItemRequest(@JsonAlias("name") String description) {
}
