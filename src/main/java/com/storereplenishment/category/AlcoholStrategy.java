package com.storereplenishment.category;

import com.storereplenishment.forecast.SafetyPolicy;

import java.time.DayOfWeek;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Shared rules of beer, soju, wine and spirits: two days of safety stock, three ahead of the
 * weekend peak, and no order once a week of demand is on hand or on the way.
 */
public abstract class AlcoholStrategy extends AbstractCategoryStrategy {

    static final double MAX_STOCK_DAYS = 7.0;
    static final double STOP_STOCK_DAYS = 7.0;
    static final double SAFETY_DAYS = 2.0;
    static final double WEEKEND_SAFETY_DAYS = 3.0;

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        DayOfWeek day = context.targetDate().getDayOfWeek();
        boolean weekendPeak = day == DayOfWeek.FRIDAY || day == DayOfWeek.SATURDAY;
        return SafetyPolicy.fixed(weekendPeak ? WEEKEND_SAFETY_DAYS : SAFETY_DAYS);
    }

    @Override
    protected OptionalDouble maxStockDays() {
        return OptionalDouble.of(MAX_STOCK_DAYS);
    }

    @Override
    public Optional<String> stopReason(CategoryContext context) {
        double stopStock = context.dailyAverage() * STOP_STOCK_DAYS;
        if (context.dailyAverage() > 0 && context.onHand() >= stopStock) {
            return Optional.of(String.format("stock+pending %d >= max stock %.1f", context.onHand(), stopStock));
        }
        return Optional.empty();
    }
}
