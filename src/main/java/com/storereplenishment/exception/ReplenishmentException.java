package com.storereplenishment.exception;

import lombok.Getter;

@Getter
public abstract class ReplenishmentException extends RuntimeException {
    private final String errorCode;
    protected ReplenishmentException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ReplenishmentException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
