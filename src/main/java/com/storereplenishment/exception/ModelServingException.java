package com.storereplenishment.exception;

public class ModelServingException extends ReplenishmentException {
    public ModelServingException(String message) {
        super("MODEL_SERVING_ERROR", message);
    }
    public ModelServingException(String message, Throwable cause) {
        super("MODEL_SERVING_ERROR", message, cause);
    }
}
