package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Cosmetics, stationery, toys, umbrellas and other display goods. Keep the shelf
 * covered and no more: at most three days of demand, at least one unit.
 */
@Component
public class GeneralMerchandiseStrategy extends AbstractCategoryStrategy {

    static final double SAFETY_DAYS = 1.0;
    static final double MAX_STOCK_DAYS = 3.0;
    static final int MIN_STOCK_UNITS = 1;
    static final double ULTRA_LOW_DAILY_AVERAGE = 0.3;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.GENERAL_MERCHANDISE;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("054", "055", "058", "059", "061", "062", "063", "064",
                      "066", "067", "068", "069", "070", "071");
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        // barely-selling items are replaced only once sold
        if (context.dailyAverage() < ULTRA_LOW_DAILY_AVERAGE) {
            return SafetyPolicy.fixed(0.0);
        }
        return SafetyPolicy.fixed(SAFETY_DAYS);
    }

    @Override
    public OptionalDouble maxStockQty(CategoryContext context) {
        return OptionalDouble.of(Math.max(context.dailyAverage() * MAX_STOCK_DAYS, MIN_STOCK_UNITS));
    }

    @Override
    public Optional<String> stopReason(CategoryContext context) {
        double maxStock = maxStockQty(context).getAsDouble();
        if (context.onHand() >= maxStock) {
            return Optional.of(String.format("stock+pending %d >= max stock %.1f", context.onHand(), maxStock));
        }
        return Optional.empty();
    }
}
