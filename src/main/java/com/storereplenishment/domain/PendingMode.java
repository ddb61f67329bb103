package com.storereplenishment.domain;

public enum PendingMode {
    AGGREGATE,
    SIMPLIFIED,
    /** Runs both algorithms, orders on the aggregate figure and collects difference stats. */
    COMPARE
}
