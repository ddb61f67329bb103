package com.storereplenishment.forecast;

/** What the run learned about the demand model before the first item. */
public record ModelStatus(boolean available, int featureCount, String modelVersion, String reason) {

    public static ModelStatus unavailable(String reason) {
        return new ModelStatus(false, 0, null, reason);
    }
}
