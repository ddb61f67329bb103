package com.storereplenishment.service;

import com.storereplenishment.category.AdjustedDemand;
import com.storereplenishment.category.CategoryContext;
import com.storereplenishment.category.CategoryRuleResolver;
import com.storereplenishment.category.CategoryStrategy;
import com.storereplenishment.collector.StoreDataGateway;
import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.CategoryProfile;
import com.storereplenishment.domain.InventorySnapshot;
import com.storereplenishment.domain.ProductInfo;
import com.storereplenishment.domain.Promotion;
import com.storereplenishment.domain.RunContext;
import com.storereplenishment.domain.SalesRecord;
import com.storereplenishment.exception.ItemDataException;
import com.storereplenishment.feature.FeatureEngine;
import com.storereplenishment.feature.SalesFeatures;
import com.storereplenishment.forecast.BaselineEstimate;
import com.storereplenishment.forecast.BaselineForecaster;
import com.storereplenishment.forecast.BlendResult;
import com.storereplenishment.forecast.DisuseRateCalculator;
import com.storereplenishment.forecast.DisuseStats;
import com.storereplenishment.forecast.FeatureVectorBuilder;
import com.storereplenishment.forecast.MLEnsembleBlender;
import com.storereplenishment.forecast.SafetyPolicy;
import com.storereplenishment.forecast.SafetyStock;
import com.storereplenishment.forecast.SafetyStockCalculator;
import com.storereplenishment.order.OrderInputs;
import com.storereplenishment.order.OrderQuantity;
import com.storereplenishment.order.OrderQuantityResolver;
import com.storereplenishment.order.PendingQuantityReconciler;
import com.storereplenishment.order.PendingResult;
import com.storereplenishment.order.PromotionMinOrderCorrector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Runs one item from raw history to a unit-rounded order. The run date is the day
 * before the target date: stock, pending and history are read as of that day.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ItemForecastPipeline {

    /** Enough history for the one-year lag plus its rolling windows. */
    static final int HISTORY_DAYS = 400;

    private final StoreDataGateway storeDataGateway;
    private final FeatureEngine featureEngine;
    private final BaselineForecaster baselineForecaster;
    private final CategoryRuleResolver categoryRuleResolver;
    private final MLEnsembleBlender blender;
    private final SafetyStockCalculator safetyStockCalculator;
    private final DisuseRateCalculator disuseRateCalculator;
    private final PendingQuantityReconciler pendingQuantityReconciler;
    private final OrderQuantityResolver orderQuantityResolver;
    private final PromotionMinOrderCorrector promotionMinOrderCorrector;

    public ItemForecast forecast(ProductInfo product, RunContext context, RunScope scope) {
        String itemId = product.itemId();
        if (itemId == null || itemId.isBlank()) {
            throw new ItemDataException(String.valueOf(itemId), "missing item id");
        }
        LocalDate target = context.targetDate();
        LocalDate today = target.minusDays(1);

        List<SalesRecord> history = storeDataGateway.salesHistory(
            context.storeId(), itemId, target.minusDays(HISTORY_DAYS), today);
        SalesFeatures features = featureEngine.compute(history, target);
        BaselineEstimate baseline = baselineForecaster.forecast(features, history, target);

        CategoryStrategy strategy = categoryRuleResolver.resolve(product.categoryCode());
        CategoryGroup group = strategy.group();
        CategoryProfile profile = categoryRuleResolver.profile(strategy, history, target);
        double trend = categoryRuleResolver.trendCoefficient(features.rollingMean(7), features.rollingMean(28));

        InventorySnapshot inventory = storeDataGateway.inventory(context.storeId(), itemId, today);
        PendingResult pending = pendingQuantityReconciler.reconcile(
            itemId, history, today, context, scope.pendingStats());

        CategoryContext categoryContext = new CategoryContext(itemId, target, profile, features.dailyAverage(),
            trend, inventory.stockQty(), pending.pendingQty(), product.orderUnit(), product.shelfLifeDays());
        AdjustedDemand adjusted = strategy.apply(baseline.dailyDemand(), categoryContext);

        Optional<Promotion> promotion = storeDataGateway.activePromotion(context.storeId(), itemId, target);
        BlendResult blend = blender.blend(adjusted.adjusted(),
            new FeatureVectorBuilder.FeatureInput(itemId, target, features, group, promotion.isPresent(),
                product.shelfLifeDays(), product.orderUnit(), product.marginRate()),
            scope.modelStatus(), context);

        SafetyPolicy policy = strategy.safetyPolicy(categoryContext);
        DisuseRateCalculator.DisuseDiscount disuse = policy.disuseDiscount()
            ? disuseDiscount(itemId, strategy, history, context, scope)
            : DisuseRateCalculator.DisuseDiscount.none();
        SafetyStock safety = safetyStockCalculator.calculate(policy, product.shelfLifeDays(),
            features.dailyAverage(), features.coefficientOfVariation(), disuse.coefficient());

        OptionalDouble maxStock = strategy.maxStockQty(categoryContext);
        OrderInputs inputs = OrderInputs.builder()
            .itemId(itemId)
            .adjustedForecast(blend.forecast())
            .safetyStock(safety.units())
            .stockQty(inventory.stockQty())
            .pendingQty(pending.pendingQty())
            .orderUnit(product.orderUnit())
            .maxMultiplier(context.order().maxMultiplier())
            .maxStockQty(maxStock.isPresent() ? maxStock.getAsDouble() : null)
            .stopReason(strategy.stopReason(categoryContext).orElse(null))
            .build();
        OrderQuantity order = orderQuantityResolver.resolve(inputs);

        int qty = order.qty();
        if (promotion.isPresent()) {
            qty = promotionMinOrderCorrector.correct(itemId, qty, promotion.get(), product.orderUnit(), target);
        }

        log.debug("Item forecast | item={} | group={} | tier={} | baseline={} | adjusted={} | forecast={} | safety={} | stock={} ({}) | pending={} | need={} | qty={}",
            itemId, group, baseline.tier(), round(baseline.dailyDemand()), round(adjusted.adjusted()),
            round(blend.forecast()), round(safety.units()), inventory.stockQty(), inventory.source(),
            pending.pendingQty(), round(order.need()), qty);

        return new ItemForecast(product, group, features, baseline, adjusted, blend, disuse, safety,
            inventory, pending, inputs, order, qty, promotion.orElse(null));
    }

    private DisuseRateCalculator.DisuseDiscount disuseDiscount(String itemId, CategoryStrategy strategy,
                                                              List<SalesRecord> history, RunContext context,
                                                              RunScope scope) {
        RunContext.DisuseSettings settings = context.disuse();
        LocalDate target = context.targetDate();
        DisuseStats category = scope.categoryDisuse(strategy.group(), g -> storeDataGateway.categoryDisuse(
            context.storeId(), strategy.categoryCodes(), target.minusDays(settings.lookbackDays()), target));
        return disuseRateCalculator.coefficient(itemId,
            disuseRateCalculator.itemStats(history, target, settings), category, context);
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
