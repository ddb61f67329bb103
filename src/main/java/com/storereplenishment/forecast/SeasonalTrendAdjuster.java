package com.storereplenishment.forecast;

import com.storereplenishment.domain.CategoryGroup;
import org.springframework.stereotype.Component;

import java.time.Month;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Month-level seasonal multipliers per category family and the short-versus-long
 * window trend multiplier.
 */
@Component
public class SeasonalTrendAdjuster {

    static final double STRONG_TREND = 0.20;
    static final double MODERATE_TREND = 0.10;
    static final double STRONG_UP = 1.15;
    static final double UP = 1.08;
    static final double DOWN = 0.92;
    static final double STRONG_DOWN = 0.85;

    private static final List<Double> FLAT = Collections.nCopies(12, 1.0);

    private static final Map<CategoryGroup, List<Double>> SEASONAL = new EnumMap<>(Map.of(
        CategoryGroup.BEER, List.of(0.78, 0.80, 0.90, 1.00, 1.15, 1.35, 1.35, 1.35, 1.10, 0.95, 0.85, 0.78),
        CategoryGroup.FROZEN_ICE, List.of(0.60, 0.65, 0.80, 0.95, 1.15, 1.40, 1.60, 1.50, 1.20, 0.95, 0.75, 0.60),
        CategoryGroup.BEVERAGE, List.of(0.90, 0.90, 0.95, 1.00, 1.05, 1.15, 1.15, 1.15, 1.05, 1.00, 0.95, 0.90)
    ));

    public List<Double> seasonalProfile(CategoryGroup group) {
        return SEASONAL.getOrDefault(group, FLAT);
    }

    public double seasonalCoefficient(CategoryGroup group, Month month) {
        return seasonalProfile(group).get(month.getValue() - 1);
    }

    /** 1.0 when either window is missing or the long window averaged zero. */
    public double trendCoefficient(Double shortMean, Double longMean) {
        if (shortMean == null || longMean == null || longMean <= 0) {
            return 1.0;
        }
        double change = shortMean / longMean - 1.0;
        if (change >= STRONG_TREND) {
            return STRONG_UP;
        }
        if (change >= MODERATE_TREND) {
            return UP;
        }
        if (change <= -STRONG_TREND) {
            return STRONG_DOWN;
        }
        if (change <= -MODERATE_TREND) {
            return DOWN;
        }
        return 1.0;
    }
}
