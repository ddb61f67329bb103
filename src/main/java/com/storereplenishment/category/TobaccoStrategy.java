package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/** Shelf space for tobacco is fixed, so the cap is an absolute unit count. */
@Component
public class TobaccoStrategy extends AbstractCategoryStrategy {

    static final int MAX_STOCK_UNITS = 30;
    static final double SAFETY_DAYS = 2.0;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.TOBACCO;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("072", "073");
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        return SafetyPolicy.fixed(SAFETY_DAYS);
    }

    @Override
    public Optional<String> stopReason(CategoryContext context) {
        int onHand = context.onHand();
        if (onHand >= MAX_STOCK_UNITS) {
            return Optional.of("stock+pending " + onHand + " >= " + MAX_STOCK_UNITS);
        }
        int space = MAX_STOCK_UNITS - onHand;
        if (space < context.orderUnit()) {
            return Optional.of("space " + space + " < order unit " + context.orderUnit());
        }
        return Optional.empty();
    }

    @Override
    public OptionalDouble maxStockQty(CategoryContext context) {
        return OptionalDouble.of(MAX_STOCK_UNITS);
    }
}
