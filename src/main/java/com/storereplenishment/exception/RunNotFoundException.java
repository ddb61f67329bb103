package com.storereplenishment.exception;

import java.util.UUID;

public class RunNotFoundException extends ReplenishmentException {
    public RunNotFoundException(UUID jobId) {
        super("RUN_NOT_FOUND", "Replenishment run not found: " + jobId);
    }
}
