package com.todoinsight.server.web.dto;

public record GreetingResponse(String greeting) {
}
