package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Lunch boxes, rice balls, sandwiches and other short-life food. Safety stock is
 * discounted by the recent discard rate; daily item counts are capped.
 */
@Component
public class FoodStrategy extends AbstractCategoryStrategy {

    static final double SAFETY_CEILING_DAYS = 1.5;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.FOOD;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("001", "002", "003", "004", "005", "012");
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        return SafetyPolicy.perishable(DEFAULT_SAFETY_FLOOR_DAYS, SAFETY_CEILING_DAYS);
    }
}
