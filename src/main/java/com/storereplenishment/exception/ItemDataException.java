package com.storereplenishment.exception;

/** Bad or missing data for a single item; the batch records it and moves on. */
public class ItemDataException extends ReplenishmentException {
    public ItemDataException(String itemId, String message) {
        super("ITEM_DATA_ERROR", "Item " + itemId + ": " + message);
    }
    public ItemDataException(String itemId, String message, Throwable cause) {
        super("ITEM_DATA_ERROR", "Item " + itemId + ": " + message, cause);
    }
}
