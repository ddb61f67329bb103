package com.storereplenishment.forecast;

import com.storereplenishment.domain.ConfidenceTier;
import com.storereplenishment.domain.SalesRecord;
import com.storereplenishment.feature.SalesFeatures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Blends a 7-day weighted moving average with the exponential and same-weekday
 * features, with weights chosen by how much history the item has.
 */
@Slf4j
@Component
public class BaselineForecaster {

    static final int WMA_DAYS = 7;
    private static final double[] LEADING_WEIGHTS = {0.25, 0.20, 0.15};
    private static final double TAIL_WEIGHT_TOTAL = 0.40;
    static final int EWM_SPAN = 7;

    public BaselineEstimate forecast(SalesFeatures features, List<SalesRecord> history, LocalDate targetDate) {
        ConfidenceTier tier = ConfidenceTier.forHistoryDays(features.historyDays());
        if (tier == ConfidenceTier.NONE) {
            return new BaselineEstimate(0.0, tier, 0.0, null, null);
        }

        double wma = weightedMovingAverage(history, targetDate);
        Double ewm = features.ewm(EWM_SPAN);
        Double sameWeekday = features.sameWeekdayAverage();

        List<double[]> parts = new ArrayList<>();
        if (tier == ConfidenceTier.HIGH) {
            addPart(parts, ewm, 0.40);
            addPart(parts, sameWeekday, 0.40);
            addPart(parts, wma, 0.20);
        } else if (tier == ConfidenceTier.MEDIUM) {
            addPart(parts, ewm, 0.35);
            addPart(parts, wma, 0.65);
        } else {
            addPart(parts, features.dailyAverage(), 0.50);
            addPart(parts, wma, 0.50);
        }

        double blended = renormalisedSum(parts);
        log.debug("Baseline | tier={} | wma={} | ewm={} | sameWeekday={} | blended={}",
                  tier, wma, ewm, sameWeekday, blended);
        return new BaselineEstimate(Math.max(0.0, blended), tier, wma, ewm, sameWeekday);
    }

    /**
     * Weighted moving average over the most recent days, newest first. Stockout days
     * are replaced with the mean of the days that had stock.
     */
    double weightedMovingAverage(List<SalesRecord> history, LocalDate targetDate) {
        List<SalesRecord> recent = history.stream()
            .filter(r -> r.date() != null && r.date().isBefore(targetDate))
            .sorted(Comparator.comparing(SalesRecord::date).reversed())
            .limit(WMA_DAYS)
            .toList();
        if (recent.isEmpty()) {
            return 0.0;
        }

        double inStockMean = recent.stream()
            .filter(r -> !r.isStockout())
            .mapToInt(SalesRecord::saleQty)
            .average()
            .orElse(0.0);

        double[] weights = weights(recent.size());
        double sum = 0;
        double weightSum = 0;
        for (int i = 0; i < recent.size(); i++) {
            SalesRecord r = recent.get(i);
            double value = r.isStockout() ? inStockMean : r.saleQty();
            sum += value * weights[i];
            weightSum += weights[i];
        }
        return weightSum > 0 ? sum / weightSum : 0.0;
    }

    static double[] weights(int n) {
        double[] weights = new double[n];
        for (int i = 0; i < n && i < LEADING_WEIGHTS.length; i++) {
            weights[i] = LEADING_WEIGHTS[i];
        }
        if (n > LEADING_WEIGHTS.length) {
            double each = TAIL_WEIGHT_TOTAL / (n - LEADING_WEIGHTS.length);
            for (int i = LEADING_WEIGHTS.length; i < n; i++) {
                weights[i] = each;
            }
        }
        return weights;
    }

    private static void addPart(List<double[]> parts, Double value, double weight) {
        if (value != null) {
            parts.add(new double[]{value, weight});
        }
    }

    private static double renormalisedSum(List<double[]> parts) {
        double weightSum = parts.stream().mapToDouble(p -> p[1]).sum();
        if (weightSum <= 0) {
            return 0.0;
        }
        return parts.stream().mapToDouble(p -> p[0] * p[1]).sum() / weightSum;
    }
}
