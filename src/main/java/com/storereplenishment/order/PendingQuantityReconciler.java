package com.storereplenishment.order;

import com.storereplenishment.domain.PendingMode;
import com.storereplenishment.domain.RunContext;
import com.storereplenishment.domain.SalesRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Works out how many ordered units are still on the way from the order and receipt
 * history. Both algorithms are pure functions of the history and the date.
 */
@Slf4j
@Component
public class PendingQuantityReconciler {

    public PendingResult reconcile(String itemId, List<SalesRecord> history, LocalDate today,
                                   RunContext context, PendingComparisonStats stats) {
        RunContext.OrderSettings settings = context.order();
        List<SalesRecord> window = window(history, today, settings.pendingHistoryDays());

        PendingMode mode = context.pendingMode();
        if (mode == PendingMode.SIMPLIFIED) {
            int qty = simplified(window, today, settings.simplifiedLookbackDays());
            return new PendingResult(qty, PendingMode.SIMPLIFIED, naive(window), null);
        }
        if (mode == PendingMode.COMPARE) {
            return compare(itemId, window, today, settings.simplifiedLookbackDays(), stats);
        }
        return aggregate(itemId, window, today);
    }

    /**
     * Past and today are settled separately: {@code max(0, ordered - received)} per bucket.
     * Receipts on a later day therefore cancel an earlier day's order.
     */
    PendingResult aggregate(String itemId, List<SalesRecord> window, LocalDate today) {
        int pastOrdered = 0;
        int pastReceived = 0;
        int todayOrdered = 0;
        int todayReceived = 0;
        for (SalesRecord r : window) {
            if (r.date().isBefore(today)) {
                pastOrdered += r.orderQty();
                pastReceived += r.receiveQty();
            } else {
                todayOrdered += r.orderQty();
                todayReceived += r.receiveQty();
            }
        }
        int pending = Math.max(0, pastOrdered - pastReceived) + Math.max(0, todayOrdered - todayReceived);
        int naive = naive(window);
        if (naive != pending) {
            log.info("Cross-date pending corrected | item={} | perRow={} | aggregate={} | pastOrdered={} | pastReceived={} | todayOrdered={} | todayReceived={}",
                     itemId, naive, pending, pastOrdered, pastReceived, todayOrdered, todayReceived);
        }
        return new PendingResult(pending, PendingMode.AGGREGATE, naive, null);
    }

    /** Only the latest order inside the lookback counts. */
    int simplified(List<SalesRecord> window, LocalDate today, int lookbackDays) {
        LocalDate cutoff = today.minusDays(lookbackDays);
        Optional<SalesRecord> latest = window.stream()
            .filter(r -> !r.date().isBefore(cutoff) && r.orderQty() > 0)
            .max(Comparator.comparing(SalesRecord::date));
        return latest.map(r -> Math.max(0, r.orderQty() - r.receiveQty())).orElse(0);
    }

    private PendingResult compare(String itemId, List<SalesRecord> window, LocalDate today,
                                  int lookbackDays, PendingComparisonStats stats) {
        PendingResult aggregate = aggregate(itemId, window, today);
        int simple = simplified(window, today, lookbackDays);
        if (stats != null) {
            stats.record(aggregate.pendingQty(), simple, hasCrossDatePattern(window));
        }
        if (simple != aggregate.pendingQty()) {
            log.warn("Pending algorithms disagree | item={} | aggregate={} | simplified={} | rows={}",
                     itemId, aggregate.pendingQty(), simple, window.size());
        }
        return new PendingResult(aggregate.pendingQty(), PendingMode.AGGREGATE, aggregate.naiveQty(), simple);
    }

    private static int naive(List<SalesRecord> window) {
        return window.stream().mapToInt(r -> Math.max(0, r.orderQty() - r.receiveQty())).sum();
    }

    private static boolean hasCrossDatePattern(List<SalesRecord> window) {
        boolean orderedNotReceived = window.stream().anyMatch(r -> r.orderQty() > 0 && r.receiveQty() == 0);
        boolean receivedNotOrdered = window.stream().anyMatch(r -> r.orderQty() == 0 && r.receiveQty() > 0);
        return orderedNotReceived && receivedNotOrdered;
    }

    private static List<SalesRecord> window(List<SalesRecord> history, LocalDate today, int days) {
        LocalDate from = today.minusDays(days);
        return history.stream()
            .filter(r -> r.date() != null && !r.date().isBefore(from) && !r.date().isAfter(today))
            .toList();
    }
}
