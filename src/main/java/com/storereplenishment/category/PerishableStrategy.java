package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Rice cakes, fruit and vegetables, yogurt. Safety stock is a fraction of a day set
 * by shelf life and discounted by the discard rate; stock is capped at what can sell
 * before it expires, never less than three days of demand.
 */
@Component
public class PerishableStrategy extends AbstractCategoryStrategy {

    private static final List<Double> WEEKDAY = List.of(1.00, 1.00, 1.00, 1.00, 1.00, 1.05, 1.05);
    static final int FALLBACK_SHELF_LIFE_DAYS = 7;
    static final double MIN_MAX_STOCK_DAYS = 3.0;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.PERISHABLE;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("013", "026", "046");
    }

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return WEEKDAY;
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        return SafetyPolicy.perishableFixed(safetyDays(shelfLife(context)));
    }

    static double safetyDays(int shelfLifeDays) {
        if (shelfLifeDays <= 3) {
            return 0.3;
        }
        if (shelfLifeDays <= 7) {
            return 0.5;
        }
        if (shelfLifeDays <= 14) {
            return 0.8;
        }
        return 1.0;
    }

    @Override
    public OptionalDouble maxStockQty(CategoryContext context) {
        if (context.dailyAverage() <= 0) {
            return OptionalDouble.empty();
        }
        double days = Math.max(shelfLife(context), MIN_MAX_STOCK_DAYS);
        return OptionalDouble.of(days * context.dailyAverage());
    }

    @Override
    public Optional<String> stopReason(CategoryContext context) {
        OptionalDouble max = maxStockQty(context);
        if (max.isPresent() && context.onHand() >= max.getAsDouble()) {
            return Optional.of(String.format("stock+pending %d >= shelf-life cap %.1f",
                context.onHand(), max.getAsDouble()));
        }
        return Optional.empty();
    }

    private static int shelfLife(CategoryContext context) {
        return context.shelfLifeDays() > 0 ? context.shelfLifeDays() : FALLBACK_SHELF_LIFE_DAYS;
    }
}
