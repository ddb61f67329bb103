package com.storereplenishment.feature;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;

/**
 * Sales features for one item as of a target date. A {@code null} lag, window or
 * EWM value means the history was too short for it.
 */
public record SalesFeatures(
    LocalDate targetDate,
    int historyDays,
    Map<Integer, Double> lags,
    Map<Integer, WindowStats> rolling,
    Map<Integer, Double> ewm,
    Double sameWeekdayAverage,
    Double trendRatio,
    double dailyAverage,
    double coefficientOfVariation,
    double sellDayRatio,
    double stockoutFrequency,
    int recentZeroSaleStreak
) {
    public SalesFeatures {
        lags = Collections.unmodifiableMap(lags);
        rolling = Collections.unmodifiableMap(rolling);
        ewm = Collections.unmodifiableMap(ewm);
    }

    public Double lag(int offset) {
        return lags.get(offset);
    }

    public WindowStats window(int days) {
        return rolling.get(days);
    }

    public Double rollingMean(int days) {
        WindowStats stats = rolling.get(days);
        return stats != null ? stats.mean() : null;
    }

    public Double ewm(int span) {
        return ewm.get(span);
    }
}
