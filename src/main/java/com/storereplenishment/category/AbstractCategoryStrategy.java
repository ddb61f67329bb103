package com.storereplenishment.category;

import com.storereplenishment.forecast.SafetyPolicy;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

public abstract class AbstractCategoryStrategy implements CategoryStrategy {

    protected static final List<Double> FLAT_WEEK = Collections.nCopies(7, 1.0);
    protected static final double DEFAULT_SAFETY_FLOOR_DAYS = 0.0;
    protected static final double DEFAULT_SAFETY_CEILING_DAYS = 4.0;

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return FLAT_WEEK;
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        return SafetyPolicy.shelfLife(DEFAULT_SAFETY_FLOOR_DAYS, DEFAULT_SAFETY_CEILING_DAYS);
    }

    @Override
    public OptionalDouble maxStockQty(CategoryContext context) {
        OptionalDouble days = maxStockDays();
        if (days.isEmpty() || context.dailyAverage() <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(days.getAsDouble() * context.dailyAverage());
    }

    /** Ceiling in days of average demand; none by default. */
    protected OptionalDouble maxStockDays() {
        return OptionalDouble.empty();
    }

    @Override
    public Optional<String> stopReason(CategoryContext context) {
        return Optional.empty();
    }

    /** Weekday, then seasonal, then trend; each multiplies the running estimate. */
    @Override
    public AdjustedDemand apply(double baseline, CategoryContext context) {
        double weekday = context.profile().weekdayCoefficient(context.targetDate().getDayOfWeek());
        double seasonal = context.profile().seasonalCoefficient(context.targetDate().getMonth());
        double trend = context.trendCoefficient();
        double adjusted = baseline * weekday;
        adjusted *= seasonal;
        adjusted *= trend;
        return new AdjustedDemand(baseline, weekday, seasonal, trend, Math.max(0.0, adjusted));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + group() + "]";
    }
}
