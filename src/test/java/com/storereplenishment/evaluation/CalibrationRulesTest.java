package com.storereplenishment.evaluation;

import com.storereplenishment.domain.ParameterKey;
import com.storereplenishment.domain.ParameterSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CalibrationRulesTest {

    private final CalibrationRules rules = new CalibrationRules();

    private static CalibrationInputs inputs(int suppressed, double missRate, Double minMissedExposure,
                                            int upgraded, double upgradedAccuracy,
                                            int perishable, double overShare, double underShare) {
        return new CalibrationInputs(60, 0.7, List.of(), suppressed, missRate, minMissedExposure,
                                     upgraded, upgradedAccuracy, perishable, overShare, underShare);
    }

    private static CalibrationInputs quiet() {
        return inputs(0, 0.0, null, 0, 0.0, 0, 0.0, 0.0);
    }

    @Test
    void propose_nothingBelowMinimumSamples() {
        CalibrationInputs few = new CalibrationInputs(10, 0.2, List.of(), 40, 0.5, 1.0, 30, 0.1, 30, 0.9, 0.0);

        assertThat(rules.propose(few, ParameterSet.defaults(), 50, 3)).isEmpty();
    }

    @Test
    void propose_nothingWhenAllSignalsAreQuiet() {
        assertThat(rules.propose(quiet(), ParameterSet.defaults(), 50, 3)).isEmpty();
    }

    @Test
    void propose_raisesSufficientExposureWhenPassesMiss() {
        List<ParameterChange> changes = rules.propose(
            inputs(40, 0.3, 4.0, 0, 0.0, 0, 0.0, 0.0), ParameterSet.defaults(), 50, 3);

        assertThat(changes).hasSize(1);
        ParameterChange change = changes.get(0);
        assertThat(change.key()).isEqualTo(ParameterKey.EXPOSURE_SUFFICIENT);
        assertThat(change.oldValue()).isEqualTo(3.0);
        assertThat(change.newValue()).isEqualTo(3.5);
        assertThat(change.sampleSize()).isEqualTo(60);
        assertThat(change.accuracyBefore()).isEqualTo(0.7);
    }

    @Test
    void propose_lowersSufficientExposureWhenPassesNeverMiss() {
        List<ParameterChange> changes = rules.propose(
            inputs(40, 0.0, null, 0, 0.0, 0, 0.0, 0.0), ParameterSet.defaults(), 50, 3);

        assertThat(changes).singleElement()
            .satisfies(c -> assertThat(c.newValue()).isCloseTo(2.79, within(1e-9)));
    }

    @Test
    void propose_raisesStockoutThresholdWhenUpgradesMiss() {
        List<ParameterChange> changes = rules.propose(
            inputs(0, 0.0, null, 25, 0.3, 0, 0.0, 0.0), ParameterSet.defaults(), 50, 3);

        assertThat(changes).singleElement().satisfies(c -> {
            assertThat(c.key()).isEqualTo(ParameterKey.STOCKOUT_FREQ_THRESHOLD);
            assertThat(c.newValue()).isCloseTo(0.164, within(1e-9));
        });
    }

    @Test
    void propose_reversionNeverReversesDirection() {
        ParameterSet atMinimum = ParameterSet.defaults().with(ParameterKey.STOCKOUT_FREQ_THRESHOLD, 0.05);

        List<ParameterChange> changes = rules.propose(
            inputs(0, 0.0, null, 25, 0.95, 0, 0.0, 0.0), atMinimum, 50, 3);

        assertThat(changes).isEmpty();
    }

    @Test
    void propose_perishableOverOrderRaisesMultiplier() {
        List<ParameterChange> over = rules.propose(
            inputs(0, 0.0, null, 0, 0.0, 30, 0.4, 0.5), ParameterSet.defaults(), 50, 3);
        List<ParameterChange> under = rules.propose(
            inputs(0, 0.0, null, 0, 0.0, 30, 0.1, 0.5), ParameterSet.defaults(), 50, 3);

        assertThat(over).singleElement().satisfies(c -> {
            assertThat(c.key()).isEqualTo(ParameterKey.DISUSE_MULTIPLIER);
            assertThat(c.newValue()).isCloseTo(1.27, within(1e-9));
        });
        assertThat(under).singleElement().satisfies(c -> assertThat(c.key()).isEqualTo(ParameterKey.DISUSE_FLOOR));
    }

    @Test
    void propose_limitsChangesPerCycleInRuleOrder() {
        List<ParameterChange> changes = rules.propose(
            inputs(40, 0.3, 4.0, 25, 0.3, 30, 0.4, 0.0), ParameterSet.defaults(), 50, 2);

        assertThat(changes).extracting(ParameterChange::key)
            .containsExactly(ParameterKey.EXPOSURE_SUFFICIENT, ParameterKey.STOCKOUT_FREQ_THRESHOLD);
    }

    @Test
    void propose_rebalancesWeightsTowardsPredictiveSignal() {
        List<CalibrationInputs.CorrelationSample> samples = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            samples.add(new CalibrationInputs.CorrelationSample(i, i % 2 == 0 ? 0.2 : 0.8, i));
        }
        CalibrationInputs correlated = new CalibrationInputs(60, 0.7, samples, 0, 0.0, null, 0, 0.0, 0, 0.0, 0.0);

        List<ParameterChange> changes = rules.propose(correlated, ParameterSet.defaults(), 50, 3);

        assertThat(changes).isNotEmpty();
        ParameterChange daily = changes.get(0);
        assertThat(daily.key()).isEqualTo(ParameterKey.WEIGHT_DAILY_AVG);
        assertThat(daily.newValue()).isGreaterThan(daily.oldValue());
        assertThat(daily.newValue() - daily.oldValue()).isLessThanOrEqualTo(ParameterKey.WEIGHT_DAILY_AVG.maxDelta() + 1e-9);
    }

    @Test
    void damped_staysInsideRangeAndStep() {
        for (ParameterKey key : ParameterKey.values()) {
            double next = CalibrationRules.damped(key, key.defaultValue(), key.maxValue() * 10, ParameterSet.defaults());

            assertThat(key.inRange(next)).isTrue();
            assertThat(next - key.defaultValue()).isLessThanOrEqualTo(key.maxDelta() + 1e-9);
        }
    }

    @Test
    void pearson_undefinedWithoutVariance() {
        assertThat(CalibrationRules.pearson(new double[]{1, 1, 1}, new double[]{1, 2, 3})).isNull();
        assertThat(CalibrationRules.pearson(new double[]{1}, new double[]{1})).isNull();
        assertThat(CalibrationRules.pearson(new double[]{1, 2, 3}, new double[]{2, 4, 6})).isCloseTo(1.0, within(1e-9));
    }
}
