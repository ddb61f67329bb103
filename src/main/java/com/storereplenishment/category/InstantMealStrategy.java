package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Fresh ingredients, side dishes and ready meals. One category mixes week-long and
 * year-long shelf lives, so both safety stock and the stock cap follow the item's
 * own shelf life.
 */
@Component
public class InstantMealStrategy extends AbstractCategoryStrategy {

    private static final List<Double> WEEKDAY = List.of(1.00, 1.00, 1.05, 1.05, 1.00, 0.95, 0.95);
    static final double UNKNOWN_SHELF_LIFE_SAFETY_DAYS = 1.0;
    static final double UNKNOWN_SHELF_LIFE_MAX_DAYS = 5.0;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.INSTANT_MEAL;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("027", "028", "031", "033", "035");
    }

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return WEEKDAY;
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        int shelfLife = context.shelfLifeDays();
        if (shelfLife <= 0) {
            return SafetyPolicy.fixed(UNKNOWN_SHELF_LIFE_SAFETY_DAYS);
        }
        if (shelfLife <= 7) {
            return SafetyPolicy.fixed(0.5);
        }
        if (shelfLife <= 30) {
            return SafetyPolicy.fixed(1.0);
        }
        if (shelfLife <= 180) {
            return SafetyPolicy.fixed(1.5);
        }
        return SafetyPolicy.fixed(2.0);
    }

    @Override
    public OptionalDouble maxStockQty(CategoryContext context) {
        if (context.dailyAverage() <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(maxStockDays(context.shelfLifeDays()) * context.dailyAverage());
    }

    static double maxStockDays(int shelfLifeDays) {
        if (shelfLifeDays <= 0) {
            return UNKNOWN_SHELF_LIFE_MAX_DAYS;
        }
        // fresh items may hold exactly what sells before expiry
        if (shelfLifeDays <= 7) {
            return shelfLifeDays;
        }
        return shelfLifeDays <= 30 ? 5.0 : 7.0;
    }

    @Override
    public Optional<String> stopReason(CategoryContext context) {
        OptionalDouble max = maxStockQty(context);
        if (max.isPresent() && context.onHand() >= max.getAsDouble()) {
            return Optional.of(String.format("stock+pending %d >= max stock %.1f", context.onHand(), max.getAsDouble()));
        }
        return Optional.empty();
    }
}
