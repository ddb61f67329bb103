package com.storereplenishment.exception;

public class ModelServingUnavailableException extends ReplenishmentException {
    public ModelServingUnavailableException(Throwable cause) {
        super("MODEL_SERVING_UNAVAILABLE", "Demand model service is unavailable: " + cause.getMessage(), cause);
    }
}
