package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Category-specific ordering rules. Implementations are selected by category code
 * through {@link CategoryRuleResolver}; adding a category group means adding an
 * implementation, nothing else.
 */
public interface CategoryStrategy {

    CategoryGroup group();

    /** Category codes handled by this strategy; empty for the catch-all strategy. */
    Set<String> categoryCodes();

    /** Monday-first weekday multipliers used when none can be learned from history. */
    List<Double> defaultWeekdayCoefficients();

    SafetyPolicy safetyPolicy(CategoryContext context);

    /** Upper bound on stock + pending + order in units, if the category has one. */
    OptionalDouble maxStockQty(CategoryContext context);

    /** A reason to order nothing at all for this item today, if any. */
    Optional<String> stopReason(CategoryContext context);

    AdjustedDemand apply(double baseline, CategoryContext context);
}
