package com.storereplenishment.forecast;

import com.storereplenishment.domain.ParameterKey;
import com.storereplenishment.domain.RunContext;
import com.storereplenishment.domain.SalesRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Turns recent discard history into the multiplicative discount applied to the
 * safety stock of perishable items.
 */
@Slf4j
@Component
public class DisuseRateCalculator {

    public DisuseStats itemStats(List<SalesRecord> history, LocalDate targetDate, RunContext.DisuseSettings settings) {
        LocalDate from = targetDate.minusDays(settings.lookbackDays());
        List<SalesRecord> window = history.stream()
            .filter(r -> r.date() != null && !r.date().isBefore(from) && r.date().isBefore(targetDate))
            .toList();
        int received = window.stream().mapToInt(SalesRecord::receiveQty).sum();
        int disused = window.stream().mapToInt(SalesRecord::disuseQty).sum();
        int batches = (int) window.stream().filter(r -> r.receiveQty() > 0).count();
        return new DisuseStats(received, disused, window.size(), batches, batches > 0);
    }

    public DisuseDiscount coefficient(String itemId, DisuseStats item, DisuseStats category, RunContext context) {
        RunContext.DisuseSettings settings = context.disuse();
        double floor = Math.max(settings.absoluteFloor(), context.param(ParameterKey.DISUSE_FLOOR));
        double multiplier = context.param(ParameterKey.DISUSE_MULTIPLIER);

        double rate;
        String basis;
        if (item.hasData() && isTrusted(item, settings)) {
            if (category.hasData()) {
                rate = item.rate() * settings.itemWeight() + category.rate() * (1 - settings.itemWeight());
                basis = "item+category";
            } else {
                rate = item.rate();
                basis = "item";
            }
        } else if (category.hasData()) {
            rate = category.rate();
            basis = "category";
        } else {
            return DisuseDiscount.none();
        }

        double raw = 1.0 - rate * multiplier;
        double coefficient = Math.min(1.0, Math.max(floor, raw));
        boolean floored = raw < floor;
        if (floored) {
            log.warn("Disuse coefficient floored | item={} | rate={} | raw={} | floor={}",
                     itemId, round(rate), round(raw), floor);
        }
        return new DisuseDiscount(coefficient, rate, basis, floored);
    }

    boolean isTrusted(DisuseStats stats, RunContext.DisuseSettings settings) {
        if (stats.batchLevel()) {
            return stats.batchCount() >= settings.minBatchCount();
        }
        return stats.calendarDays() >= settings.minCalendarDays();
    }

    private static double round(double v) {
        return Math.round(v * 10000.0) / 10000.0;
    }

    public record DisuseDiscount(double coefficient, double rate, String basis, boolean floored) {
        public static DisuseDiscount none() {
            return new DisuseDiscount(1.0, 0.0, "none", false);
        }
    }
}
