package com.storereplenishment.entity;

public enum PredictionStatus {
    PREDICTED,
    /** Skipped because of a data error; distinct from a SKIP decision. */
    FAILED
}
