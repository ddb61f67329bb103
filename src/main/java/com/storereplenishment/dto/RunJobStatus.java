package com.storereplenishment.dto;

public enum RunJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    ABORTED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == ABORTED || this == FAILED;
    }
}
