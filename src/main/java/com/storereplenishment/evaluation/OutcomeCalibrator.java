package com.storereplenishment.evaluation;

import com.storereplenishment.collector.StoreDataGateway;
import com.storereplenishment.config.EngineProperties;
import com.storereplenishment.domain.OutcomeClass;
import com.storereplenishment.domain.SalesRecord;
import com.storereplenishment.entity.EvalOutcome;
import com.storereplenishment.entity.PredictionLog;
import com.storereplenishment.entity.PredictionStatus;
import com.storereplenishment.repository.EvalOutcomeRepository;
import com.storereplenishment.repository.PredictionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closes the feedback loop: judges past decisions against what actually sold and
 * feeds the verdicts into parameter calibration. The only writer of calibration
 * parameters besides the startup range check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeCalibrator {

    private final PredictionLogRepository predictionLogRepository;
    private final EvalOutcomeRepository evalOutcomeRepository;
    private final StoreDataGateway storeDataGateway;
    private final ParameterStore parameterStore;
    private final CalibrationRules calibrationRules;
    private final EngineProperties properties;

    public DailyCalibrationReport runDaily(LocalDate today) {
        List<ParameterChange> clamped = clampOutOfRange(today);
        VerificationResult verification = verify(today.minusDays(1));
        CalibrationResult calibration = calibrate(today);
        return new DailyCalibrationReport(clamped, verification, calibration);
    }

    public List<ParameterChange> clampOutOfRange(LocalDate today) {
        return parameterStore.clampOutOfRange(today);
    }

    /**
     * Judges every successful decision made for {@code evalDate} whose sales for that date
     * are known. Items already judged for the date are left alone.
     */
    public VerificationResult verify(LocalDate evalDate) {
        // latest run wins when a store decided an item more than once for the same date
        Map<StoreItem, PredictionLog> latest = new LinkedHashMap<>();
        for (PredictionLog row : predictionLogRepository.findByTargetDateAndStatusOrderByCreatedAtAsc(
                evalDate, PredictionStatus.PREDICTED)) {
            if (row.getDecision() != null) {
                latest.put(new StoreItem(row.getStoreId(), row.getItemId()), row);
            }
        }

        int verified = 0;
        int already = 0;
        int missing = 0;
        Map<OutcomeClass, Integer> byOutcome = new EnumMap<>(OutcomeClass.class);

        for (PredictionLog row : latest.values()) {
            if (evalOutcomeRepository.existsByEvalDateAndStoreIdAndItemId(evalDate, row.getStoreId(), row.getItemId())) {
                already++;
                continue;
            }
            List<SalesRecord> actual = storeDataGateway.salesHistory(
                row.getStoreId(), row.getItemId(), evalDate, evalDate);
            if (actual.isEmpty()) {
                missing++;
                continue;
            }
            SalesRecord sold = actual.get(actual.size() - 1);
            boolean stockout = sold.stockQty() <= 0;
            OutcomeClass outcome = OutcomeJudge.judge(row.getDecision(), sold.saleQty(), stockout);

            evalOutcomeRepository.save(EvalOutcome.builder()
                .evalDate(evalDate)
                .storeId(row.getStoreId())
                .itemId(row.getItemId())
                .categoryGroup(row.getCategoryGroup())
                .decision(row.getDecision())
                .predictedQty(row.getFinalOrderQty())
                .dailyAverage(row.getDailyAverage())
                .popularityScore(row.getPopularityScore())
                .exposureDays(row.getExposureDays())
                .stockoutFrequency(row.getStockoutFrequency())
                .upgraded(row.isUpgraded())
                .actualSoldQty(sold.saleQty())
                .nextDayStock(sold.stockQty())
                .wasStockout(stockout)
                .outcomeClass(outcome)
                .build());
            byOutcome.merge(outcome, 1, Integer::sum);
            verified++;
        }

        log.info("Outcome verification | date={} | verified={} | already={} | missing_actuals={} | outcomes={}",
            evalDate, verified, already, missing, byOutcome);
        return new VerificationResult(evalDate, verified, already, missing, byOutcome);
    }

    public CalibrationResult calibrate(LocalDate today) {
        EngineProperties.Calibration settings = properties.getCalibration();
        List<EvalOutcome> window = evalOutcomeRepository.findByEvalDateBetweenOrderByEvalDateAsc(
            today.minusDays(settings.getAccuracyWindowDays()), today);

        if (window.size() < settings.getMinSamples()) {
            log.info("Calibration skipped | date={} | samples={} | required={}",
                today, window.size(), settings.getMinSamples());
            return CalibrationResult.skipped(today, window.size(), "insufficient samples");
        }

        CalibrationInputs inputs = CalibrationInputs.from(window);
        List<ParameterChange> changes = calibrationRules.propose(
            inputs, parameterStore.current(), settings.getMinSamples(), settings.getMaxParamsPerCycle());
        parameterStore.apply(changes, today);

        log.info("Calibration complete | date={} | samples={} | accuracy={} | changes={}",
            today, inputs.totalVerified(), String.format("%.3f", inputs.overallAccuracy()), changes.size());
        return new CalibrationResult(today, inputs.totalVerified(), inputs.overallAccuracy(), false, null, changes);
    }

    private record StoreItem(String storeId, String itemId) {
    }
}
