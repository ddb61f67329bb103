package com.storereplenishment.evaluation;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.OutcomeClass;
import com.storereplenishment.entity.EvalOutcome;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Aggregates of the verified outcome window that calibration decisions are made from.
 */
public record CalibrationInputs(
    int totalVerified,
    double overallAccuracy,
    List<CorrelationSample> correlationSamples,
    int suppressedTotal,
    double suppressedMissRate,
    Double minMissedExposure,
    int upgradedTotal,
    double upgradedAccuracy,
    int perishableTotal,
    double perishableOverShare,
    double perishableUnderShare
) {

    public record CorrelationSample(double dailyAverage, double popularity, int actualSold) {}

    public static CalibrationInputs from(List<EvalOutcome> outcomes) {
        int total = outcomes.size();
        long correct = outcomes.stream().filter(o -> o.getOutcomeClass() == OutcomeClass.CORRECT).count();

        List<CorrelationSample> samples = outcomes.stream()
            .filter(o -> o.getPopularityScore() != null)
            .map(o -> new CorrelationSample(o.getDailyAverage(), o.getPopularityScore(), o.getActualSoldQty()))
            .toList();

        List<EvalOutcome> suppressed = outcomes.stream().filter(o -> o.getDecision() == Decision.PASS).toList();
        List<EvalOutcome> missed = suppressed.stream()
            .filter(o -> o.getOutcomeClass() == OutcomeClass.UNDER_ORDER || o.getOutcomeClass() == OutcomeClass.MISS)
            .toList();
        OptionalDouble minExposure = missed.stream()
            .filter(o -> o.getExposureDays() != null)
            .mapToDouble(EvalOutcome::getExposureDays)
            .min();

        List<EvalOutcome> upgraded = outcomes.stream().filter(EvalOutcome::isUpgraded).toList();
        long upgradedCorrect = upgraded.stream().filter(o -> o.getOutcomeClass() == OutcomeClass.CORRECT).count();

        List<EvalOutcome> perishable = outcomes.stream()
            .filter(o -> CategoryGroup.FOOD.name().equals(o.getCategoryGroup()))
            .filter(o -> o.getDecision() != Decision.SKIP)
            .toList();
        long over = perishable.stream().filter(o -> o.getOutcomeClass() == OutcomeClass.OVER_ORDER).count();
        long under = perishable.stream().filter(o -> o.getOutcomeClass() == OutcomeClass.UNDER_ORDER).count();

        return new CalibrationInputs(
            total,
            ratio(correct, total),
            samples,
            suppressed.size(),
            ratio(missed.size(), suppressed.size()),
            minExposure.isPresent() ? minExposure.getAsDouble() : null,
            upgraded.size(),
            ratio(upgradedCorrect, upgraded.size()),
            perishable.size(),
            ratio(over, perishable.size()),
            ratio(under, perishable.size())
        );
    }

    private static double ratio(long part, long whole) {
        return whole == 0 ? 0.0 : (double) part / whole;
    }
}
