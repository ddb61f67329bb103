package com.storereplenishment.domain;

/**
 * Tunable coefficients owned by the outcome calibrator, with their defaults,
 * valid ranges and the largest step a single calibration cycle may take.
 */
public enum ParameterKey {
    WEIGHT_DAILY_AVG("weight_daily_avg", 0.40, 0.15, 0.60, 0.10),
    WEIGHT_SELL_DAY_RATIO("weight_sell_day_ratio", 0.35, 0.15, 0.55, 0.10),
    WEIGHT_TREND("weight_trend", 0.25, 0.10, 0.40, 0.10),
    EXPOSURE_URGENT("exposure_urgent", 1.0, 0.5, 2.0, 0.3),
    EXPOSURE_NORMAL("exposure_normal", 2.0, 1.0, 3.5, 0.3),
    EXPOSURE_SUFFICIENT("exposure_sufficient", 3.0, 2.0, 5.0, 0.5),
    STOCKOUT_FREQ_THRESHOLD("stockout_freq_threshold", 0.15, 0.05, 0.35, 0.03),
    TARGET_ACCURACY("target_accuracy", 0.60, 0.50, 0.80, 0.05),
    CALIBRATION_DECAY("calibration_decay", 0.7, 0.3, 1.0, 0.1),
    CALIBRATION_REVERSION_RATE("calibration_reversion_rate", 0.1, 0.0, 0.3, 0.05),
    DISUSE_FLOOR("disuse_floor", 0.65, 0.50, 0.90, 0.05),
    DISUSE_MULTIPLIER("disuse_multiplier", 1.2, 0.5, 2.0, 0.2);

    private final String paramName;
    private final double defaultValue;
    private final double minValue;
    private final double maxValue;
    private final double maxDelta;

    ParameterKey(String paramName, double defaultValue, double minValue, double maxValue, double maxDelta) {
        this.paramName = paramName;
        this.defaultValue = defaultValue;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.maxDelta = maxDelta;
    }

    public String paramName() { return paramName; }
    public double defaultValue() { return defaultValue; }
    public double minValue() { return minValue; }
    public double maxValue() { return maxValue; }
    public double maxDelta() { return maxDelta; }

    public double clamp(double value) {
        return Math.max(minValue, Math.min(maxValue, value));
    }

    public boolean inRange(double value) {
        return value >= minValue && value <= maxValue;
    }

    /** Moves {@code current} towards {@code target} by at most {@link #maxDelta()}, then clamps to range. */
    public double step(double current, double target) {
        double delta = Math.max(-maxDelta, Math.min(maxDelta, target - current));
        return clamp(current + delta);
    }

    public static ParameterKey fromParamName(String name) {
        for (ParameterKey key : values()) {
            if (key.paramName.equals(name)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown calibration parameter: " + name);
    }
}
