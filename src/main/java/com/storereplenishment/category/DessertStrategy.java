package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Cakes, cream breads and packaged sweets. Safety days shrink for slow movers and
 * the stock cap stays inside the shelf life.
 */
@Component
public class DessertStrategy extends AbstractCategoryStrategy {

    private static final List<Double> WEEKDAY = List.of(1.00, 1.00, 1.00, 1.00, 1.00, 1.05, 1.05);
    static final int FALLBACK_SHELF_LIFE_DAYS = 14;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.DESSERT;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("014");
    }

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return WEEKDAY;
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        return SafetyPolicy.fixed(baseSafetyDays(shelfLife(context)) * turnoverAdjustment(context.dailyAverage()));
    }

    static double baseSafetyDays(int shelfLifeDays) {
        if (shelfLifeDays <= 15) {
            return 0.3;
        }
        return shelfLifeDays <= 30 ? 0.5 : 0.7;
    }

    static double turnoverAdjustment(double dailyAverage) {
        if (dailyAverage >= 5.0) {
            return 1.0;
        }
        return dailyAverage >= 2.0 ? 0.9 : 0.7;
    }

    static double maxStockDays(int shelfLifeDays) {
        if (shelfLifeDays <= 15) {
            return Math.max(shelfLifeDays - 1, 2);
        }
        if (shelfLifeDays <= 30) {
            return Math.min(shelfLifeDays - 1, 5);
        }
        return 5.0;
    }

    @Override
    public OptionalDouble maxStockQty(CategoryContext context) {
        if (context.dailyAverage() <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(maxStockDays(shelfLife(context)) * context.dailyAverage());
    }

    @Override
    public Optional<String> stopReason(CategoryContext context) {
        OptionalDouble max = maxStockQty(context);
        if (max.isPresent() && context.onHand() >= max.getAsDouble()) {
            return Optional.of(String.format("stock+pending %d >= max stock %.1f", context.onHand(), max.getAsDouble()));
        }
        return Optional.empty();
    }

    private static int shelfLife(CategoryContext context) {
        return context.shelfLifeDays() > 0 ? context.shelfLifeDays() : FALLBACK_SHELF_LIFE_DAYS;
    }
}
