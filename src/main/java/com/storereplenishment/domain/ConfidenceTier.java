package com.storereplenishment.domain;

public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    public static ConfidenceTier forHistoryDays(int days) {
        if (days >= 14) {
            return HIGH;
        }
        if (days >= 7) {
            return MEDIUM;
        }
        return days > 0 ? LOW : NONE;
    }
}
