package com.storereplenishment.feature;

import com.storereplenishment.domain.SalesRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lag, rolling-window and exponentially weighted sales features. Pure: the result
 * depends only on the history passed in and the target date.
 */
@Component
public class FeatureEngine {

    public static final int[] LAG_OFFSETS = {1, 7, 14, 28, 365};
    public static final int[] ROLLING_WINDOWS = {7, 14, 28, 90};
    public static final int[] EWM_SPANS = {7, 14};
    static final int SAME_WEEKDAY_WEEKS = 4;
    static final int PROFILE_WINDOW_DAYS = 28;

    public SalesFeatures compute(List<SalesRecord> history, LocalDate targetDate) {
        List<SalesRecord> past = priorRecords(history, targetDate);
        Map<LocalDate, SalesRecord> byDate = past.stream()
            .collect(Collectors.toMap(SalesRecord::date, Function.identity(), (a, b) -> b));

        Map<Integer, Double> lags = new HashMap<>();
        for (int offset : LAG_OFFSETS) {
            SalesRecord record = byDate.get(targetDate.minusDays(offset));
            lags.put(offset, record != null ? (double) record.saleQty() : null);
        }

        Map<Integer, WindowStats> rolling = new HashMap<>();
        for (int window : ROLLING_WINDOWS) {
            rolling.put(window, windowStats(past, targetDate, window));
        }

        Map<Integer, Double> ewm = new HashMap<>();
        for (int span : EWM_SPANS) {
            ewm.put(span, exponentialMean(past, span));
        }

        Double shortMean = rolling.get(7) != null ? rolling.get(7).mean() : null;
        Double longMean = rolling.get(28) != null ? rolling.get(28).mean() : null;
        Double trendRatio = (shortMean != null && longMean != null && longMean > 0)
            ? shortMean / longMean : null;

        List<SalesRecord> profile = tail(past, PROFILE_WINDOW_DAYS);
        double[] sales = profile.stream().mapToDouble(SalesRecord::saleQty).toArray();
        double average = mean(sales);
        double cv = average > 0 && sales.length > 1 ? sampleStd(sales, average) / average : 0.0;
        double sellDayRatio = profile.isEmpty() ? 0.0
            : profile.stream().filter(r -> r.saleQty() > 0).count() / (double) profile.size();
        double stockoutFrequency = profile.isEmpty() ? 0.0
            : profile.stream().filter(r -> r.stockQty() <= 0).count() / (double) profile.size();

        return new SalesFeatures(
            targetDate,
            past.size(),
            lags,
            rolling,
            ewm,
            sameWeekdayAverage(byDate, targetDate),
            trendRatio,
            average,
            cv,
            sellDayRatio,
            stockoutFrequency,
            zeroSaleStreak(past)
        );
    }

    static List<SalesRecord> priorRecords(List<SalesRecord> history, LocalDate targetDate) {
        return history.stream()
            .filter(r -> r.date() != null && r.date().isBefore(targetDate))
            .sorted(Comparator.comparing(SalesRecord::date))
            .toList();
    }

    static <T> List<T> tail(List<T> list, int n) {
        return list.subList(Math.max(0, list.size() - n), list.size());
    }

    private WindowStats windowStats(List<SalesRecord> past, LocalDate targetDate, int window) {
        LocalDate from = targetDate.minusDays(window);
        double[] values = past.stream()
            .filter(r -> !r.date().isBefore(from))
            .mapToDouble(SalesRecord::saleQty)
            .toArray();
        if (values.length < window) {
            return null;
        }
        double avg = mean(values);
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new WindowStats(window, avg, sampleStd(values, avg), min, max);
    }

    private Double exponentialMean(List<SalesRecord> past, int span) {
        if (past.size() < span) {
            return null;
        }
        double alpha = 2.0 / (span + 1);
        List<SalesRecord> points = tail(past, span * 2);
        double value = points.get(0).saleQty();
        for (int i = 1; i < points.size(); i++) {
            value = alpha * points.get(i).saleQty() + (1 - alpha) * value;
        }
        return value;
    }

    private Double sameWeekdayAverage(Map<LocalDate, SalesRecord> byDate, LocalDate targetDate) {
        double sum = 0;
        int count = 0;
        for (int week = 1; week <= SAME_WEEKDAY_WEEKS; week++) {
            SalesRecord record = byDate.get(targetDate.minusWeeks(week));
            if (record != null) {
                sum += record.saleQty();
                count++;
            }
        }
        return count > 0 ? sum / count : null;
    }

    private int zeroSaleStreak(List<SalesRecord> past) {
        int streak = 0;
        for (int i = past.size() - 1; i >= 0 && past.get(i).saleQty() == 0; i--) {
            streak++;
        }
        return streak;
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    static double sampleStd(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }
}
