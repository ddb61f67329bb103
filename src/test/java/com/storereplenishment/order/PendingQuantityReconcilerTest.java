package com.storereplenishment.order;

import com.storereplenishment.TestFixtures;
import com.storereplenishment.domain.PendingMode;
import com.storereplenishment.domain.SalesRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PendingQuantityReconcilerTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private final PendingQuantityReconciler reconciler = new PendingQuantityReconciler();

    private static SalesRecord row(LocalDate date, int ordered, int received) {
        return new SalesRecord(date, "I-1", 0, ordered, received, 0, 4);
    }

    private final List<SalesRecord> crossDate = List.of(
        row(TODAY.minusDays(2), 10, 0),
        row(TODAY.minusDays(1), 0, 10)
    );

    @Test
    void aggregate_receiptOnLaterDaySettlesEarlierOrder() {
        PendingResult result = reconciler.reconcile("I-1", crossDate, TODAY,
            TestFixtures.context(TODAY.plusDays(1)), null);

        assertThat(result.pendingQty()).isZero();
        assertThat(result.naiveQty()).isEqualTo(10);
        assertThat(result.corrected()).isTrue();
        assertThat(result.source()).isEqualTo(PendingMode.AGGREGATE);
    }

    @Test
    void aggregate_todaysOpenOrderIsPending() {
        List<SalesRecord> history = List.of(
            row(TODAY.minusDays(2), 10, 0),
            row(TODAY.minusDays(1), 0, 10),
            row(TODAY, 6, 0)
        );

        PendingResult result = reconciler.reconcile("I-1", history, TODAY,
            TestFixtures.context(TODAY.plusDays(1)), null);

        assertThat(result.pendingQty()).isEqualTo(6);
    }

    @Test
    void aggregate_ignoresRowsOutsideWindow() {
        List<SalesRecord> history = List.of(
            row(TODAY.minusDays(20), 12, 0),
            row(TODAY.minusDays(1), 4, 0)
        );

        PendingResult result = reconciler.reconcile("I-1", history, TODAY,
            TestFixtures.context(TODAY.plusDays(1)), null);

        assertThat(result.pendingQty()).isEqualTo(4);
    }

    @Test
    void reconcile_isIdempotent() {
        var context = TestFixtures.context(TODAY.plusDays(1));

        PendingResult first = reconciler.reconcile("I-1", crossDate, TODAY, context, null);
        PendingResult second = reconciler.reconcile("I-1", crossDate, TODAY, context, null);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void simplified_usesLatestOrderOnly() {
        PendingResult result = reconciler.reconcile("I-1", crossDate, TODAY,
            TestFixtures.context(TODAY.plusDays(1), PendingMode.SIMPLIFIED), null);

        assertThat(result.source()).isEqualTo(PendingMode.SIMPLIFIED);
        assertThat(result.pendingQty()).isEqualTo(10);
    }

    @Test
    void compare_ordersWithAggregateAndRecordsDisagreement() {
        PendingComparisonStats stats = new PendingComparisonStats();

        PendingResult result = reconciler.reconcile("I-1", crossDate, TODAY,
            TestFixtures.context(TODAY.plusDays(1), PendingMode.COMPARE), stats);

        assertThat(result.pendingQty()).isZero();
        assertThat(result.comparisonQty()).isEqualTo(10);
        assertThat(stats.getTotal()).isEqualTo(1);
        assertThat(stats.getDifferences()).isEqualTo(1);
        assertThat(stats.getSimplifiedHigher()).isEqualTo(1);
        assertThat(stats.getCrossDateCases()).isEqualTo(1);
        assertThat(stats.getMaxDifference()).isEqualTo(10);
        assertThat(stats.matchRate()).isZero();
    }
}
