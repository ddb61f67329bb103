package com.storereplenishment.forecast;

import com.storereplenishment.TestFixtures;
import com.storereplenishment.domain.ParameterKey;
import com.storereplenishment.domain.ParameterSet;
import com.storereplenishment.domain.PendingMode;
import com.storereplenishment.domain.RunContext;
import com.storereplenishment.domain.SalesRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DisuseRateCalculatorTest {

    private static final LocalDate TARGET = LocalDate.of(2026, 3, 10);

    private final DisuseRateCalculator calculator = new DisuseRateCalculator();
    private final RunContext context = TestFixtures.context(TARGET);

    private static DisuseStats trusted(int received, int disused) {
        return new DisuseStats(received, disused, 30, 20, true);
    }

    @Test
    void coefficient_neverDropsBelowFloor() {
        DisuseRateCalculator.DisuseDiscount discount =
            calculator.coefficient("I-1", trusted(100, 90), DisuseStats.empty(), context);

        assertThat(discount.coefficient()).isEqualTo(ParameterKey.DISUSE_FLOOR.defaultValue());
        assertThat(discount.floored()).isTrue();
        assertThat(discount.basis()).isEqualTo("item");
    }

    @Test
    void coefficient_absoluteFloorHoldsAgainstLowCalibratedFloor() {
        RunContext lowFloor = TestFixtures.context(TARGET, PendingMode.AGGREGATE,
            ParameterSet.defaults().with(ParameterKey.DISUSE_FLOOR, 0.2), false);

        DisuseRateCalculator.DisuseDiscount discount =
            calculator.coefficient("I-1", trusted(100, 100), DisuseStats.empty(), lowFloor);

        assertThat(discount.coefficient()).isEqualTo(0.5);
    }

    @Test
    void coefficient_blendsTrustedItemWithCategory() {
        DisuseRateCalculator.DisuseDiscount discount =
            calculator.coefficient("I-1", trusted(100, 10), new DisuseStats(1000, 200, 30, 0, false), context);

        double rate = 0.1 * 0.8 + 0.2 * 0.2;
        assertThat(discount.rate()).isCloseTo(rate, within(1e-9));
        assertThat(discount.coefficient()).isCloseTo(1.0 - rate * 1.2, within(1e-9));
        assertThat(discount.basis()).isEqualTo("item+category");
    }

    @Test
    void coefficient_fallsBackToCategoryWhenItemSampleIsThin() {
        DisuseStats thin = new DisuseStats(20, 10, 10, 3, true);

        DisuseRateCalculator.DisuseDiscount discount =
            calculator.coefficient("I-1", thin, new DisuseStats(1000, 100, 30, 0, false), context);

        assertThat(discount.basis()).isEqualTo("category");
        assertThat(discount.rate()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void coefficient_noDataMeansNoDiscount() {
        DisuseRateCalculator.DisuseDiscount discount =
            calculator.coefficient("I-1", DisuseStats.empty(), DisuseStats.empty(), context);

        assertThat(discount.coefficient()).isEqualTo(1.0);
        assertThat(discount.basis()).isEqualTo("none");
    }

    @Test
    void itemStats_countsReceivingBatchesInsideLookback() {
        List<SalesRecord> history = new ArrayList<>();
        history.add(new SalesRecord(TARGET.minusDays(40), "I-1", 3, 0, 50, 50, 0));
        for (int i = 1; i <= 10; i++) {
            history.add(new SalesRecord(TARGET.minusDays(i), "I-1", 3, 4, i % 2 == 0 ? 4 : 0, 1, 2));
        }

        DisuseStats stats = calculator.itemStats(history, TARGET, context.disuse());

        assertThat(stats.receivedQty()).isEqualTo(20);
        assertThat(stats.disusedQty()).isEqualTo(10);
        assertThat(stats.batchCount()).isEqualTo(5);
        assertThat(stats.calendarDays()).isEqualTo(10);
        assertThat(stats.batchLevel()).isTrue();
    }
}
