package com.storereplenishment.evaluation;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.OutcomeClass;
import com.storereplenishment.entity.EvalOutcome;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CalibrationInputsTest {

    private static EvalOutcome outcome(Decision decision, OutcomeClass outcomeClass, CategoryGroup group,
                                       double exposure, boolean upgraded) {
        return EvalOutcome.builder()
            .evalDate(LocalDate.of(2026, 3, 9))
            .itemId("I-1")
            .categoryGroup(group.name())
            .decision(decision)
            .dailyAverage(2.0)
            .popularityScore(0.4)
            .exposureDays(exposure)
            .upgraded(upgraded)
            .actualSoldQty(1)
            .outcomeClass(outcomeClass)
            .build();
    }

    @Test
    void from_aggregatesOutcomeWindow() {
        CalibrationInputs inputs = CalibrationInputs.from(List.of(
            outcome(Decision.PASS, OutcomeClass.UNDER_ORDER, CategoryGroup.SNACK, 3.4, false),
            outcome(Decision.PASS, OutcomeClass.CORRECT, CategoryGroup.SNACK, 5.0, false),
            outcome(Decision.URGENT_ORDER, OutcomeClass.CORRECT, CategoryGroup.FOOD, 0.5, true),
            outcome(Decision.NORMAL_ORDER, OutcomeClass.OVER_ORDER, CategoryGroup.FOOD, 1.5, true),
            outcome(Decision.SKIP, OutcomeClass.MISS, CategoryGroup.FOOD, 9.0, false)
        ));

        assertThat(inputs.totalVerified()).isEqualTo(5);
        assertThat(inputs.overallAccuracy()).isCloseTo(0.4, within(1e-9));
        assertThat(inputs.suppressedTotal()).isEqualTo(2);
        assertThat(inputs.suppressedMissRate()).isEqualTo(0.5);
        assertThat(inputs.minMissedExposure()).isEqualTo(3.4);
        assertThat(inputs.upgradedTotal()).isEqualTo(2);
        assertThat(inputs.upgradedAccuracy()).isEqualTo(0.5);
        assertThat(inputs.perishableTotal()).isEqualTo(2);
        assertThat(inputs.perishableOverShare()).isEqualTo(0.5);
        assertThat(inputs.correlationSamples()).hasSize(5);
    }

    @Test
    void from_emptyWindowHasNoMissedExposure() {
        CalibrationInputs inputs = CalibrationInputs.from(List.of());

        assertThat(inputs.totalVerified()).isZero();
        assertThat(inputs.minMissedExposure()).isNull();
        assertThat(inputs.overallAccuracy()).isZero();
    }
}
