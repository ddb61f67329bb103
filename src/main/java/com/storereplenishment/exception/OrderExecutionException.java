package com.storereplenishment.exception;

public class OrderExecutionException extends ReplenishmentException {
    public OrderExecutionException(String message) {
        super("ORDER_EXECUTION_ERROR", message);
    }
    public OrderExecutionException(String message, Throwable cause) {
        super("ORDER_EXECUTION_ERROR", message, cause);
    }
}
