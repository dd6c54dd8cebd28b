package com.todoinsight.server.error;

public class InvalidItemPayloadException extends TodoException {

    public InvalidItemPayloadException(String detail) {
        super(TodoErrorCode.INVALID_ITEM_PAYLOAD, detail);
    }
}
