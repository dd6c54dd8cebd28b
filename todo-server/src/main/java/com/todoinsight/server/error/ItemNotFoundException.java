package com.todoinsight.server.error;

public class ItemNotFoundException extends TodoException {

    public ItemNotFoundException(String id) {
        super(TodoErrorCode.ITEM_NOT_FOUND, id);
    }
}
