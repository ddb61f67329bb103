package com.storereplenishment.category;

import com.storereplenishment.TestFixtures;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class WeekdayCoefficientLearnerTest {

    // a Tuesday
    private static final LocalDate TARGET = LocalDate.of(2026, 3, 10);

    private final WeekdayCoefficientLearner learner = new WeekdayCoefficientLearner();

    @Test
    void learn_ratiosAgainstOverallMean() {
        // starts on a Tuesday: Saturday and Sunday sell double
        Optional<List<Double>> learned = learner.learn(
            TestFixtures.history(TARGET, 28, 10, 10, 10, 10, 20, 20, 10), TARGET);

        assertThat(learned).isPresent();
        List<Double> coefficients = learned.get();
        assertThat(coefficients).hasSize(7);
        assertThat(coefficients.get(0)).isEqualTo(0.78);
        assertThat(coefficients.get(5)).isEqualTo(1.56);
        assertThat(coefficients.get(6)).isEqualTo(1.56);
    }

    @Test
    void learn_needsTwoWeeksOfHistory() {
        assertThat(learner.learn(TestFixtures.history(TARGET, 13, 5), TARGET)).isEmpty();
    }

    @Test
    void learn_rejectsHistoryWithoutSales() {
        assertThat(learner.learn(TestFixtures.history(TARGET, 28, 0), TARGET)).isEmpty();
    }

    @Test
    void learn_clampsExtremeWeekdays() {
        Optional<List<Double>> learned = learner.learn(
            TestFixtures.history(TARGET, 28, 1, 1, 1, 1, 1, 1, 60), TARGET);

        assertThat(learned).isPresent();
        assertThat(learned.get()).allSatisfy(c -> assertThat(c).isBetween(0.5, 2.5));
        assertThat(learned.get().get(0)).isEqualTo(2.5);
    }
}
