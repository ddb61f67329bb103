package com.storereplenishment.service;

import com.storereplenishment.category.CategoryRuleResolver;
import com.storereplenishment.category.CategoryStrategy;
import com.storereplenishment.client.OrderExecutionGateway;
import com.storereplenishment.client.OrderLine;
import com.storereplenishment.collector.StoreDataGateway;
import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.InventorySnapshot;
import com.storereplenishment.domain.PendingMode;
import com.storereplenishment.domain.ProductInfo;
import com.storereplenishment.domain.RunContext;
import com.storereplenishment.dto.RunRequest;
import com.storereplenishment.dto.RunSummary;
import com.storereplenishment.evaluation.EvalParameters;
import com.storereplenishment.evaluation.EvaluationBatch;
import com.storereplenishment.evaluation.EvaluationResult;
import com.storereplenishment.evaluation.PreOrderEvaluator;
import com.storereplenishment.forecast.MLEnsembleBlender;
import com.storereplenishment.forecast.ModelStatus;
import com.storereplenishment.order.CapAllocation;
import com.storereplenishment.order.CapCandidate;
import com.storereplenishment.order.CategoryDailyCapAllocator;
import com.storereplenishment.order.DailyOrderCount;
import com.storereplenishment.order.OrderInputs;
import com.storereplenishment.order.OrderQuantityResolver;
import com.storereplenishment.order.PendingComparisonStats;
import com.storereplenishment.order.PromotionMinOrderCorrector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One replenishment run for one store and target date. Items are processed one at a
 * time; a failing item is recorded and skipped, never allowed to stop the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReplenishmentRunService {

    static final String DATA_ERROR = "skipped due to data error";
    static final String CAP_REASON = "category cap";

    private final RunContextFactory runContextFactory;
    private final StoreDataGateway storeDataGateway;
    private final ItemForecastPipeline pipeline;
    private final MLEnsembleBlender blender;
    private final PreOrderEvaluator preOrderEvaluator;
    private final CategoryDailyCapAllocator capAllocator;
    private final CategoryRuleResolver categoryRuleResolver;
    private final OrderQuantityResolver orderQuantityResolver;
    private final PromotionMinOrderCorrector promotionMinOrderCorrector;
    private final PredictionLogWriter logWriter;
    private final OrderExecutionGateway orderExecutionGateway;

    public RunSummary execute(RunRequest request, AbortSignal abort) {
        Instant startedAt = Instant.now();
        LocalDate target = request.getTargetDate() != null ? request.getTargetDate() : LocalDate.now().plusDays(1);
        RunContext context = runContextFactory.create(
            request.getStoreId(), target, request.isDryRun(), request.getPendingMode());
        ModelStatus modelStatus = blender.checkModel(context);
        RunScope scope = new RunScope(modelStatus);

        List<ProductInfo> products = storeDataGateway.products();
        log.info("Run started | runId={} | store={} | target={} | items={} | model={}",
            context.runId(), context.storeId(), target, products.size(),
            modelStatus.available() ? modelStatus.modelVersion() : "off (" + modelStatus.reason() + ")");

        List<ItemForecast> forecasts = new ArrayList<>();
        List<RunSummary.FailedItem> failed = new ArrayList<>();
        boolean aborted = false;
        for (ProductInfo product : products) {
            if (abort.isAbortRequested()) {
                aborted = true;
                log.warn("Run aborted | runId={} | processed={} | remaining={}",
                    context.runId(), forecasts.size() + failed.size(),
                    products.size() - forecasts.size() - failed.size());
                break;
            }
            try {
                forecasts.add(pipeline.forecast(product, context, scope));
            } catch (RuntimeException ex) {
                log.error("Item {} | runId={} | item={} | error={}",
                    DATA_ERROR, context.runId(), product.itemId(), ex.getMessage(), ex);
                failed.add(failedItem(product.itemId(), ex));
                recordFailure(context, product, ex);
            }
        }

        RunSummary.RunSummaryBuilder summary = RunSummary.builder()
            .runId(context.runId())
            .storeId(context.storeId())
            .targetDate(target)
            .dryRun(context.dryRun())
            .pendingMode(context.pendingMode())
            .totalItems(products.size())
            .modelAvailable(modelStatus.available())
            .startedAt(startedAt);

        if (aborted) {
            return summary
                .aborted(true)
                .failed(failed.size())
                .failedItems(failed)
                .completedAt(Instant.now())
                .build();
        }

        Map<String, ItemDecision> decisions = evaluate(forecasts, context);
        int capDropped = applyDailyCaps(forecasts, decisions, context);
        int recalculated = recheckAtOrderTime(forecasts, decisions, context);

        List<OrderLine> lines = new ArrayList<>();
        Map<Decision, Long> byDecision = new EnumMap<>(Decision.class);
        int predicted = 0;
        int totalQty = 0;
        int stale = 0;
        int blended = 0;
        for (ItemForecast forecast : forecasts) {
            ItemDecision decision = decisions.get(forecast.itemId());
            try {
                logWriter.writePredicted(context, forecast, decision);
            } catch (RuntimeException ex) {
                log.error("Prediction log write failed, item not ordered | runId={} | item={} | error={}",
                    context.runId(), forecast.itemId(), ex.getMessage(), ex);
                failed.add(failedItem(forecast.itemId(), ex));
                continue;
            }
            predicted++;
            byDecision.merge(decision.decision(), 1L, Long::sum);
            if (forecast.inventory().stale()) {
                stale++;
            }
            if (forecast.blend().blended()) {
                blended++;
            }
            if (decision.finalQty() > 0) {
                lines.add(new OrderLine(forecast.itemId(), decision.finalQty(), decision.decision()));
                totalQty += decision.finalQty();
            }
        }

        summary
            .predicted(predicted)
            .failed(failed.size())
            .failedItems(failed)
            .decisions(byDecision)
            .orderedItems(lines.size())
            .totalOrderQty(totalQty)
            .capDropped(capDropped)
            .staleInventory(stale)
            .recalculated(recalculated)
            .blendedItems(blended);

        if (context.pendingMode() == PendingMode.COMPARE) {
            summary.pendingComparison(comparison(scope.pendingStats()));
        }
        submit(context, lines, summary);

        RunSummary result = summary.completedAt(Instant.now()).build();
        log.info("Run complete | runId={} | predicted={} | failed={} | ordered={} | qty={} | capDropped={} | decisions={}",
            context.runId(), result.getPredicted(), result.getFailed(), result.getOrderedItems(),
            result.getTotalOrderQty(), capDropped, byDecision);
        return result;
    }

    private Map<String, ItemDecision> evaluate(List<ItemForecast> forecasts, RunContext context) {
        EvaluationBatch batch = preOrderEvaluator.evaluate(
            forecasts.stream().map(ItemForecast::toEvalCandidate).toList(),
            EvalParameters.from(context.parameters()));
        Map<String, EvaluationResult> byItem = new LinkedHashMap<>();
        for (EvaluationResult result : batch.results()) {
            byItem.put(result.itemId(), result);
        }
        Map<String, ItemDecision> decisions = new LinkedHashMap<>();
        for (ItemForecast forecast : forecasts) {
            EvaluationResult r = byItem.get(forecast.itemId());
            String reason = forecast.order().reason() != null && r.finalQty() == 0
                ? r.reason() + "; " + forecast.order().reason()
                : r.reason();
            decisions.put(forecast.itemId(), new ItemDecision(r.itemId(), r.decision(), r.finalQty(), reason,
                r.exposureDays(), r.popularity(), r.stockoutFrequency(), r.upgraded(), null));
        }
        return decisions;
    }

    /** @return number of items whose order the cap removed */
    private int applyDailyCaps(List<ItemForecast> forecasts, Map<String, ItemDecision> decisions, RunContext context) {
        Map<CategoryGroup, List<CapCandidate>> byGroup = new EnumMap<>(CategoryGroup.class);
        for (ItemForecast forecast : forecasts) {
            if (forecast.group().isDailyCapped()) {
                int qty = decisions.get(forecast.itemId()).finalQty();
                byGroup.computeIfAbsent(forecast.group(), g -> new ArrayList<>()).add(forecast.toCapCandidate(qty));
            }
        }

        int dropped = 0;
        LocalDate target = context.targetDate();
        for (Map.Entry<CategoryGroup, List<CapCandidate>> entry : byGroup.entrySet()) {
            Set<String> codes = categoryRuleResolver.forGroup(entry.getKey())
                .map(CategoryStrategy::categoryCodes)
                .orElse(Set.of());
            List<DailyOrderCount> history = storeDataGateway.orderedItemCounts(context.storeId(), codes,
                target.minusDays(context.dailyCap().lookbackDays()), target);
            CapAllocation allocation = capAllocator.allocate(entry.getKey(), entry.getValue(), target, history, context);
            for (String itemId : allocation.dropped()) {
                ItemDecision decision = decisions.get(itemId);
                decisions.put(itemId, decision.withQty(0, decision.reason() + "; " + CAP_REASON));
                dropped++;
            }
        }
        return dropped;
    }

    /**
     * Re-reads inventory for every item about to be ordered and recomputes the order when
     * stock or pending moved since prediction time.
     *
     * @return number of orders whose quantity changed
     */
    private int recheckAtOrderTime(List<ItemForecast> forecasts, Map<String, ItemDecision> decisions,
                                   RunContext context) {
        LocalDate today = context.targetDate().minusDays(1);
        int changed = 0;
        for (ItemForecast forecast : forecasts) {
            ItemDecision decision = decisions.get(forecast.itemId());
            if (decision.finalQty() <= 0) {
                continue;
            }
            InventorySnapshot orderTime;
            try {
                orderTime = storeDataGateway.inventory(context.storeId(), forecast.itemId(), today);
            } catch (RuntimeException ex) {
                log.warn("Order-time inventory unavailable, keeping prediction-time order | item={} | error={}",
                    forecast.itemId(), ex.getMessage());
                continue;
            }
            int qty = recalculate(forecast, decision, orderTime);
            if (qty != decision.finalQty()) {
                log.info("Order recalculated at order time | item={} | stock {} -> {} | pending {} -> {} | qty {} -> {}",
                    forecast.itemId(), forecast.inventory().stockQty(), orderTime.stockQty(),
                    forecast.inventory().pendingQty(), orderTime.pendingQty(), decision.finalQty(), qty);
                changed++;
            }
            decisions.put(forecast.itemId(), decision.withOrderTime(orderTime, qty));
        }
        return changed;
    }

    private int recalculate(ItemForecast forecast, ItemDecision decision, InventorySnapshot orderTime) {
        InventorySnapshot predictionTime = forecast.inventory();
        if (orderTime.stockQty() == predictionTime.stockQty() && orderTime.pendingQty() == predictionTime.pendingQty()) {
            return decision.finalQty();
        }
        int pendingGrowth = Math.max(0, orderTime.pendingQty() - predictionTime.pendingQty());
        OrderInputs inputs = forecast.orderInputs().toBuilder()
            .stockQty(orderTime.stockQty())
            .pendingQty(forecast.pending().pendingQty() + pendingGrowth)
            .build();
        int qty = orderQuantityResolver.resolve(inputs).qty();
        ProductInfo product = forecast.product();
        if (forecast.promotion() != null) {
            qty = promotionMinOrderCorrector.correct(product.itemId(), qty, forecast.promotion(),
                product.orderUnit(), forecast.features().targetDate());
        }
        if (decision.decision() == Decision.FORCE_ORDER && orderTime.stockQty() <= 0) {
            qty = Math.max(qty, product.orderUnit());
        }
        return orderQuantityResolver.guardRecalculation(product.itemId(), decision.finalQty(), qty,
            predictionTime, orderTime, product.shelfLifeDays(), forecast.group().isPerishable());
    }

    private void submit(RunContext context, List<OrderLine> lines, RunSummary.RunSummaryBuilder summary) {
        if (context.dryRun()) {
            log.info("Dry run, orders not submitted | runId={} | lines={}", context.runId(), lines.size());
            return;
        }
        if (lines.isEmpty()) {
            return;
        }
        try {
            int accepted = orderExecutionGateway.submit(context.storeId(), context.targetDate().minusDays(1),
                lines, context.runId().toString());
            summary.submittedLines(lines.size()).acceptedLines(accepted);
        } catch (RuntimeException ex) {
            log.error("Order submission failed | runId={} | lines={} | error={}",
                context.runId(), lines.size(), ex.getMessage(), ex);
            summary.submittedLines(lines.size()).acceptedLines(0).submissionError(ex.getMessage());
        }
    }

    private void recordFailure(RunContext context, ProductInfo product, RuntimeException cause) {
        try {
            logWriter.writeFailed(context, product, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (RuntimeException ex) {
            log.error("Failure row could not be written | runId={} | item={} | error={}",
                context.runId(), product.itemId(), ex.getMessage());
        }
    }

    private static RunSummary.FailedItem failedItem(String itemId, RuntimeException ex) {
        return RunSummary.FailedItem.builder()
            .itemId(itemId)
            .reason(DATA_ERROR + ": " + (ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()))
            .build();
    }

    private static RunSummary.PendingComparison comparison(PendingComparisonStats stats) {
        return RunSummary.PendingComparison.builder()
            .total(stats.getTotal())
            .matches(stats.getMatches())
            .differences(stats.getDifferences())
            .aggregateHigher(stats.getAggregateHigher())
            .simplifiedHigher(stats.getSimplifiedHigher())
            .maxDifference(stats.getMaxDifference())
            .crossDateCases(stats.getCrossDateCases())
            .matchRate(stats.matchRate())
            .build();
    }
}
