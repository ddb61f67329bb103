package com.storereplenishment.service;

import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.OutcomeClass;
import com.storereplenishment.dto.CalibrationHistoryResponse;
import com.storereplenishment.dto.ParameterResponse;
import com.storereplenishment.dto.SummaryReport;
import com.storereplenishment.entity.CalibrationHistory;
import com.storereplenishment.evaluation.ParameterStore;
import com.storereplenishment.repository.CalibrationHistoryRepository;
import com.storereplenishment.repository.EvalOutcomeRepository;
import com.storereplenishment.repository.PredictionLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Read-only aggregates over prediction logs, outcomes and calibration state. */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReportQueryService {

    static final int MAX_HISTORY_ROWS = 500;

    private final PredictionLogRepository predictionLogRepository;
    private final EvalOutcomeRepository evalOutcomeRepository;
    private final CalibrationHistoryRepository calibrationHistoryRepository;
    private final ParameterStore parameterStore;

    public SummaryReport dailySummary(LocalDate date) {
        return summary(date, date);
    }

    /** Seven days ending on {@code weekEnd}, inclusive. */
    public SummaryReport weeklySummary(LocalDate weekEnd) {
        return summary(weekEnd.minusDays(6), weekEnd);
    }

    public List<CalibrationHistoryResponse> calibrationHistory(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY_ROWS));
        return calibrationHistoryRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, size))
            .stream()
            .map(ReportQueryService::toResponse)
            .toList();
    }

    public List<ParameterResponse> currentParameters() {
        return parameterStore.all().stream()
            .sorted(Comparator.comparing(p -> p.getParamName()))
            .map(p -> ParameterResponse.builder()
                .paramName(p.getParamName())
                .currentValue(p.getCurrentValue())
                .defaultValue(p.getDefaultValue())
                .minValue(p.getMinValue())
                .maxValue(p.getMaxValue())
                .lastAdjustedReason(p.getLastAdjustedReason())
                .updatedAt(p.getUpdatedAt())
                .build())
            .toList();
    }

    private SummaryReport summary(LocalDate from, LocalDate to) {
        Map<String, SummaryReport.GroupTotals> groups = new LinkedHashMap<>();
        long totalQty = 0;
        for (Object[] row : predictionLogRepository.countByCategoryGroup(from, to)) {
            String group = row[0] != null ? row[0].toString() : "UNKNOWN";
            long items = toLong(row[1]);
            long qty = toLong(row[2]);
            groups.put(group, SummaryReport.GroupTotals.builder().items(items).orderQty(qty).build());
            totalQty += qty;
        }

        Map<Decision, Long> decisions = new EnumMap<>(Decision.class);
        for (Object[] row : predictionLogRepository.countByDecision(from, to)) {
            if (row[0] != null) {
                decisions.put((Decision) row[0], toLong(row[1]));
            }
        }

        Map<OutcomeClass, Long> outcomes = new EnumMap<>(OutcomeClass.class);
        for (Object[] row : evalOutcomeRepository.countByOutcomeClass(from, to)) {
            outcomes.put((OutcomeClass) row[0], toLong(row[1]));
        }
        long verified = outcomes.values().stream().mapToLong(Long::longValue).sum();
        Double accuracy = verified > 0
            ? (double) outcomes.getOrDefault(OutcomeClass.CORRECT, 0L) / verified
            : null;

        return SummaryReport.builder()
            .from(from)
            .to(to)
            .byCategoryGroup(groups)
            .byDecision(decisions)
            .byOutcome(outcomes)
            .failedItems(predictionLogRepository.countFailed(from, to))
            .staleInventoryItems(predictionLogRepository.countStale(from, to))
            .totalOrderQty(totalQty)
            .accuracyRate(accuracy)
            .build();
    }

    private static CalibrationHistoryResponse toResponse(CalibrationHistory h) {
        return CalibrationHistoryResponse.builder()
            .calibrationDate(h.getCalibrationDate())
            .paramName(h.getParamName())
            .oldValue(h.getOldValue())
            .newValue(h.getNewValue())
            .reason(h.getReason())
            .accuracyBefore(h.getAccuracyBefore())
            .sampleSize(h.getSampleSize())
            .createdAt(h.getCreatedAt())
            .build();
    }

    private static long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
