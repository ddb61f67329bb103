package com.storereplenishment.feature;

import com.storereplenishment.TestFixtures;
import com.storereplenishment.domain.SalesRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureEngineTest {

    private static final LocalDate TARGET = LocalDate.of(2026, 3, 10);

    private final FeatureEngine engine = new FeatureEngine();

    @Test
    void compute_derivesProfileFromPriorDays() {
        List<SalesRecord> history = TestFixtures.history(TARGET, 21, 7, 13, 10);

        SalesFeatures features = engine.compute(history, TARGET);

        assertThat(features.historyDays()).isEqualTo(21);
        assertThat(features.dailyAverage()).isCloseTo(10.0, within(1e-9));
        assertThat(features.coefficientOfVariation()).isCloseTo(0.251, within(0.001));
        assertThat(features.sellDayRatio()).isEqualTo(1.0);
        assertThat(features.stockoutFrequency()).isZero();
        assertThat(features.recentZeroSaleStreak()).isZero();
    }

    @Test
    void compute_leavesFeaturesOutWhenHistoryIsShort() {
        SalesFeatures features = engine.compute(TestFixtures.history(TARGET, 21, 7, 13, 10), TARGET);

        assertThat(features.lag(1)).isEqualTo(10.0);
        assertThat(features.lag(7)).isEqualTo(10.0);
        assertThat(features.lag(14)).isEqualTo(13.0);
        assertThat(features.lag(28)).isNull();
        assertThat(features.lag(365)).isNull();
        assertThat(features.window(7)).isNotNull();
        assertThat(features.window(28)).isNull();
        assertThat(features.trendRatio()).isNull();
        assertThat(features.ewm(7)).isNotNull();
        assertThat(features.sameWeekdayAverage()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void compute_ignoresRecordsOnOrAfterTargetDate() {
        List<SalesRecord> history = new ArrayList<>(TestFixtures.history(TARGET, 21, 7, 13, 10));
        history.add(TestFixtures.sale(TARGET, 500, 5));
        history.add(TestFixtures.sale(TARGET.plusDays(1), 500, 5));

        SalesFeatures features = engine.compute(history, TARGET);

        assertThat(features.historyDays()).isEqualTo(21);
        assertThat(features.dailyAverage()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void compute_countsStockoutsAndZeroSaleStreak() {
        List<SalesRecord> history = new ArrayList<>(TestFixtures.history(TARGET.minusDays(3), 10, 4));
        history.add(TestFixtures.sale(TARGET.minusDays(3), 0, 0));
        history.add(TestFixtures.sale(TARGET.minusDays(2), 0, 0));
        history.add(TestFixtures.sale(TARGET.minusDays(1), 0, 3));

        SalesFeatures features = engine.compute(history, TARGET);

        assertThat(features.recentZeroSaleStreak()).isEqualTo(3);
        assertThat(features.stockoutFrequency()).isCloseTo(2.0 / 13, within(1e-9));
        assertThat(features.sellDayRatio()).isCloseTo(10.0 / 13, within(1e-9));
    }

    @Test
    void compute_isPureForSameInput() {
        List<SalesRecord> history = TestFixtures.history(TARGET, 40, 3, 8, 1, 0, 6);

        assertThat(engine.compute(history, TARGET)).isEqualTo(engine.compute(history, TARGET));
    }

    @Test
    void compute_emptyHistoryGivesZeroProfile() {
        SalesFeatures features = engine.compute(List.of(), TARGET);

        assertThat(features.historyDays()).isZero();
        assertThat(features.dailyAverage()).isZero();
        assertThat(features.coefficientOfVariation()).isZero();
        assertThat(features.sameWeekdayAverage()).isNull();
    }
}
