package com.storereplenishment.service;

import com.storereplenishment.domain.ProductInfo;
import com.storereplenishment.domain.RunContext;
import com.storereplenishment.entity.PredictionLog;
import com.storereplenishment.entity.PredictionStatus;
import com.storereplenishment.repository.PredictionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Writes prediction log rows, each in a transaction of its own. */
@Slf4j
@Component
@RequiredArgsConstructor
public class PredictionLogWriter {

    private static final int MAX_ERROR_LENGTH = 500;

    private final PredictionLogRepository repository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PredictionLog writePredicted(RunContext context, ItemForecast forecast, ItemDecision decision) {
        ProductInfo product = forecast.product();
        PredictionLog row = PredictionLog.builder()
            .runId(context.runId())
            .storeId(context.storeId())
            .targetDate(context.targetDate())
            .itemId(product.itemId())
            .categoryCode(product.categoryCode())
            .categoryGroup(forecast.group().name())
            .status(PredictionStatus.PREDICTED)
            .baselineQty(forecast.baseline().dailyDemand())
            .adjustedQty(forecast.adjusted().adjusted())
            .forecastQty(forecast.blend().forecast())
            .modelForecast(forecast.blend().modelForecast())
            .modelWeight(forecast.blend().modelWeight())
            .dailyAverage(forecast.features().dailyAverage())
            .safetyStock(forecast.safetyStock().units())
            .stockQty(forecast.inventory().stockQty())
            .pendingQty(forecast.pending().pendingQty())
            .stockSource(forecast.inventory().source())
            .pendingSource(forecast.pending().source())
            .stockStale(forecast.inventory().stale())
            .confidenceTier(forecast.baseline().tier())
            .orderQty(forecast.orderQty())
            .finalOrderQty(decision.finalQty())
            .decision(decision.decision())
            .decisionReason(truncate(decision.reason()))
            .exposureDays(decision.exposureDays())
            .popularityScore(decision.popularity())
            .stockoutFrequency(decision.stockoutFrequency())
            .upgraded(decision.upgraded())
            .orderTimeStock(decision.orderTime() != null ? decision.orderTime().stockQty() : null)
            .orderTimePending(decision.orderTime() != null ? decision.orderTime().pendingQty() : null)
            .build();
        return repository.save(row);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PredictionLog writeFailed(RunContext context, ProductInfo product, String error) {
        PredictionLog row = PredictionLog.builder()
            .runId(context.runId())
            .storeId(context.storeId())
            .targetDate(context.targetDate())
            .itemId(product.itemId())
            .categoryCode(product.categoryCode())
            .status(PredictionStatus.FAILED)
            .errorMessage(truncate(error))
            .build();
        return repository.save(row);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
