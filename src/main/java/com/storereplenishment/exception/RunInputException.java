package com.storereplenishment.exception;

public class RunInputException extends ReplenishmentException {
    public RunInputException(String message) {
        super("RUN_INPUT_ERROR", message);
    }
}
