package com.storereplenishment.category;

import com.storereplenishment.domain.SalesRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Learns an item's weekday profile: each weekday's mean sale divided by the overall
 * mean, clamped to [0.5, 2.5].
 */
@Component
public class WeekdayCoefficientLearner {

    static final int MIN_HISTORY_DAYS = 14;
    static final int MIN_SAMPLES_PER_WEEKDAY = 2;
    static final int LOOKBACK_DAYS = 56;
    static final double MIN_COEFFICIENT = 0.5;
    static final double MAX_COEFFICIENT = 2.5;

    public Optional<List<Double>> learn(List<SalesRecord> history, LocalDate targetDate) {
        LocalDate from = targetDate.minusDays(LOOKBACK_DAYS);
        double[] sums = new double[7];
        int[] counts = new int[7];
        double total = 0;
        int days = 0;
        for (SalesRecord record : history) {
            if (record.date() == null || record.date().isBefore(from) || !record.date().isBefore(targetDate)) {
                continue;
            }
            int index = record.date().getDayOfWeek().getValue() - 1;
            sums[index] += record.saleQty();
            counts[index]++;
            total += record.saleQty();
            days++;
        }
        if (days < MIN_HISTORY_DAYS || total <= 0) {
            return Optional.empty();
        }
        for (int count : counts) {
            if (count < MIN_SAMPLES_PER_WEEKDAY) {
                return Optional.empty();
            }
        }

        double overall = total / days;
        List<Double> coefficients = new ArrayList<>(7);
        for (int i = 0; i < 7; i++) {
            double ratio = (sums[i] / counts[i]) / overall;
            double clamped = Math.max(MIN_COEFFICIENT, Math.min(MAX_COEFFICIENT, ratio));
            coefficients.add(Math.round(clamped * 100.0) / 100.0);
        }
        return Optional.of(coefficients);
    }
}
