package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Tissues, toiletries, batteries. Nothing expires and a stockout sends the customer
 * elsewhere, so an empty shelf is always reordered even above the stock cap.
 */
@Component
public class DailyNecessityStrategy extends AbstractCategoryStrategy {

    static final double SAFETY_DAYS = 1.5;
    static final double MAX_STOCK_DAYS = 10.0;
    static final int MIN_STOCK_UNITS = 1;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.DAILY_NECESSITY;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("036", "037", "056", "057", "086");
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        return SafetyPolicy.fixed(SAFETY_DAYS);
    }

    @Override
    protected OptionalDouble maxStockDays() {
        return OptionalDouble.of(MAX_STOCK_DAYS);
    }

    @Override
    public Optional<String> stopReason(CategoryContext context) {
        if (context.stockQty() <= 0) {
            return Optional.empty();
        }
        double maxStock = context.dailyAverage() > 0 ? context.dailyAverage() * MAX_STOCK_DAYS : MIN_STOCK_UNITS;
        if (context.onHand() >= maxStock) {
            return Optional.of(String.format("stock+pending %d >= max stock %.1f", context.onHand(), maxStock));
        }
        return Optional.empty();
    }
}
