package com.storereplenishment.service;

import com.storereplenishment.category.AdjustedDemand;
import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.InventorySnapshot;
import com.storereplenishment.domain.ProductInfo;
import com.storereplenishment.domain.Promotion;
import com.storereplenishment.evaluation.EvalCandidate;
import com.storereplenishment.feature.SalesFeatures;
import com.storereplenishment.forecast.BaselineEstimate;
import com.storereplenishment.forecast.BlendResult;
import com.storereplenishment.forecast.DisuseRateCalculator;
import com.storereplenishment.forecast.SafetyStock;
import com.storereplenishment.order.CapCandidate;
import com.storereplenishment.order.OrderInputs;
import com.storereplenishment.order.OrderQuantity;
import com.storereplenishment.order.PendingResult;

/**
 * Everything the pipeline worked out for one item, up to a unit-rounded order
 * quantity. Evaluation and the daily cap act on it afterwards.
 *
 * @param orderQty  order after promotion correction
 * @param promotion promotion active on the target date, {@code null} when none
 */
public record ItemForecast(
    ProductInfo product,
    CategoryGroup group,
    SalesFeatures features,
    BaselineEstimate baseline,
    AdjustedDemand adjusted,
    BlendResult blend,
    DisuseRateCalculator.DisuseDiscount disuse,
    SafetyStock safetyStock,
    InventorySnapshot inventory,
    PendingResult pending,
    OrderInputs orderInputs,
    OrderQuantity order,
    int orderQty,
    Promotion promotion
) {

    public String itemId() {
        return product.itemId();
    }

    public CapCandidate toCapCandidate(int qty) {
        return new CapCandidate(itemId(), qty, features.historyDays(), blend.forecast(),
            features.recentZeroSaleStreak());
    }

    public EvalCandidate toEvalCandidate() {
        return EvalCandidate.builder()
            .itemId(itemId())
            .dailyAverage(features.dailyAverage())
            .stockQty(inventory.stockQty())
            .pendingQty(pending.pendingQty())
            .sellDayRatio(features.sellDayRatio())
            .trendRatio(features.trendRatio())
            .stockoutFrequency(features.stockoutFrequency())
            .excluded(product.excluded())
            .exclusionReason(product.exclusionReason())
            .orderQty(orderQty)
            .orderUnit(product.orderUnit())
            .build();
    }
}
