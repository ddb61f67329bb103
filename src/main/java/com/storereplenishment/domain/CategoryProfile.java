package com.storereplenishment.domain;

import java.time.DayOfWeek;
import java.time.Month;
import java.util.List;

/**
 * Configuration of a category group as used in one run. Weekday coefficients are
 * indexed Monday first; seasonal coefficients January first.
 */
public record CategoryProfile(
    CategoryGroup group,
    List<Double> weekdayCoefficients,
    boolean weekdayLearned,
    List<Double> seasonalCoefficients,
    double safetyStockFloorDays,
    double safetyStockCeilingDays
) {
    public CategoryProfile {
        if (weekdayCoefficients.size() != 7) {
            throw new IllegalArgumentException("weekday coefficients need 7 values, got " + weekdayCoefficients.size());
        }
        if (seasonalCoefficients.size() != 12) {
            throw new IllegalArgumentException("seasonal coefficients need 12 values, got " + seasonalCoefficients.size());
        }
        weekdayCoefficients = List.copyOf(weekdayCoefficients);
        seasonalCoefficients = List.copyOf(seasonalCoefficients);
    }

    public double weekdayCoefficient(DayOfWeek day) {
        return weekdayCoefficients.get(day.getValue() - 1);
    }

    public double seasonalCoefficient(Month month) {
        return seasonalCoefficients.get(month.getValue() - 1);
    }
}
