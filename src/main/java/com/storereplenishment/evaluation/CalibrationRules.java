package com.storereplenishment.evaluation;

import com.storereplenishment.domain.ParameterKey;
import com.storereplenishment.domain.ParameterSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Proposes parameter adjustments from a window of verified outcomes.
 *
 * <p>Every proposal is damped (decay towards the raw target plus reversion towards the
 * default) and then limited to the key's per-cycle step and valid range. A proposal
 * whose damped move would land on the wrong side of the current value, or not move it
 * at all, is dropped so a parameter is only ever moved in the corrective direction.
 * Holds no state; persistence is the caller's job.
 */
@Slf4j
@Component
public class CalibrationRules {

    static final int MIN_SCOPE_SAMPLES = 20;
    static final int MIN_LOW_MISS_SAMPLES = 30;
    static final double HIGH_MISS_RATE = 0.15;
    static final double LOW_MISS_RATE = 0.05;
    static final double MIN_UPGRADE_ACCURACY = 0.5;
    static final double PERISHABLE_SHARE_LIMIT = 0.3;
    static final double MIN_WEIGHT_SHIFT = 0.05;

    public List<ParameterChange> propose(CalibrationInputs inputs, ParameterSet current,
                                         int minSamples, int maxChanges) {
        List<ParameterChange> changes = new ArrayList<>();
        if (inputs.totalVerified() < minSamples) {
            log.info("Calibration skipped | verified={} | required={}", inputs.totalVerified(), minSamples);
            return changes;
        }

        popularityWeights(inputs, current, minSamples, changes);
        sufficientExposure(inputs, current, changes);
        stockoutThreshold(inputs, current, changes);
        perishableDisuse(inputs, current, changes);

        if (changes.size() > maxChanges) {
            log.info("Calibration capped | proposed={} | applied={}", changes.size(), maxChanges);
            return new ArrayList<>(changes.subList(0, maxChanges));
        }
        return changes;
    }

    private void popularityWeights(CalibrationInputs inputs, ParameterSet current, int minSamples,
                                   List<ParameterChange> out) {
        List<CalibrationInputs.CorrelationSample> samples = inputs.correlationSamples();
        if (samples.size() < minSamples) {
            return;
        }
        double[] sold = samples.stream().mapToDouble(CalibrationInputs.CorrelationSample::actualSold).toArray();
        Double corrDaily = pearson(samples.stream().mapToDouble(CalibrationInputs.CorrelationSample::dailyAverage).toArray(), sold);
        Double corrPopularity = pearson(samples.stream().mapToDouble(CalibrationInputs.CorrelationSample::popularity).toArray(), sold);
        if (corrDaily == null || corrPopularity == null) {
            return;
        }

        double total = Math.abs(corrDaily) + Math.abs(corrPopularity) + 0.01;
        double targetDaily = Math.abs(corrDaily) / total;
        double targetSell = Math.abs(corrPopularity) / total * 0.8;
        double targetTrend = Math.max(ParameterKey.WEIGHT_TREND.minValue(), 1.0 - targetDaily - targetSell);
        double sum = targetDaily + targetSell + targetTrend;

        EvalParameters normalized = EvalParameters.from(current);
        Map<ParameterKey, double[]> pairs = Map.of(
            ParameterKey.WEIGHT_DAILY_AVG, new double[]{normalized.weightDailyAvg(), targetDaily / sum},
            ParameterKey.WEIGHT_SELL_DAY_RATIO, new double[]{normalized.weightSellDayRatio(), targetSell / sum},
            ParameterKey.WEIGHT_TREND, new double[]{normalized.weightTrend(), targetTrend / sum}
        );
        for (ParameterKey key : List.of(ParameterKey.WEIGHT_DAILY_AVG, ParameterKey.WEIGHT_SELL_DAY_RATIO, ParameterKey.WEIGHT_TREND)) {
            double shift = pairs.get(key)[1] - pairs.get(key)[0];
            if (Math.abs(shift) < MIN_WEIGHT_SHIFT) {
                continue;
            }
            double value = current.get(key);
            adjust(key, value, value + shift, current,
                String.format("weight rebalance | corr_daily=%.3f | corr_popularity=%.3f", corrDaily, corrPopularity),
                inputs, out);
        }
    }

    private void sufficientExposure(CalibrationInputs inputs, ParameterSet current, List<ParameterChange> out) {
        if (inputs.suppressedTotal() < MIN_SCOPE_SAMPLES) {
            return;
        }
        ParameterKey key = ParameterKey.EXPOSURE_SUFFICIENT;
        double value = current.get(key);
        if (inputs.suppressedMissRate() > HIGH_MISS_RATE && inputs.minMissedExposure() != null) {
            double suggested = inputs.minMissedExposure() + 1.0;
            if (suggested > value) {
                adjust(key, value, suggested, current,
                    String.format("pass miss rate %.2f above %.2f", inputs.suppressedMissRate(), HIGH_MISS_RATE),
                    inputs, out);
            }
        } else if (inputs.suppressedMissRate() < LOW_MISS_RATE && inputs.suppressedTotal() >= MIN_LOW_MISS_SAMPLES) {
            adjust(key, value, value - 0.3, current,
                String.format("pass miss rate %.2f below %.2f", inputs.suppressedMissRate(), LOW_MISS_RATE),
                inputs, out);
        }
    }

    private void stockoutThreshold(CalibrationInputs inputs, ParameterSet current, List<ParameterChange> out) {
        if (inputs.upgradedTotal() < MIN_SCOPE_SAMPLES) {
            return;
        }
        ParameterKey key = ParameterKey.STOCKOUT_FREQ_THRESHOLD;
        double value = current.get(key);
        double target = current.get(ParameterKey.TARGET_ACCURACY);
        if (inputs.upgradedAccuracy() < MIN_UPGRADE_ACCURACY) {
            adjust(key, value, value + 0.02, current,
                String.format("upgrade accuracy %.2f below %.2f", inputs.upgradedAccuracy(), MIN_UPGRADE_ACCURACY),
                inputs, out);
        } else if (inputs.upgradedAccuracy() > target + 0.15) {
            adjust(key, value, value - 0.01, current,
                String.format("upgrade accuracy %.2f well above target %.2f", inputs.upgradedAccuracy(), target),
                inputs, out);
        }
    }

    private void perishableDisuse(CalibrationInputs inputs, ParameterSet current, List<ParameterChange> out) {
        if (inputs.perishableTotal() < MIN_SCOPE_SAMPLES) {
            return;
        }
        if (inputs.perishableOverShare() > PERISHABLE_SHARE_LIMIT) {
            ParameterKey key = ParameterKey.DISUSE_MULTIPLIER;
            double value = current.get(key);
            adjust(key, value, value + 0.1, current,
                String.format("perishable over-order share %.2f", inputs.perishableOverShare()), inputs, out);
        } else if (inputs.perishableUnderShare() > PERISHABLE_SHARE_LIMIT) {
            ParameterKey key = ParameterKey.DISUSE_FLOOR;
            double value = current.get(key);
            adjust(key, value, value + 0.05, current,
                String.format("perishable under-order share %.2f", inputs.perishableUnderShare()), inputs, out);
        }
    }

    private void adjust(ParameterKey key, double value, double rawTarget, ParameterSet current,
                        String reason, CalibrationInputs inputs, List<ParameterChange> out) {
        double next = damped(key, value, rawTarget, current);
        double rawDelta = rawTarget - value;
        double delta = next - value;
        if (rawDelta == 0 || Math.signum(delta) != Math.signum(rawDelta) || Math.abs(delta) < 1e-9) {
            log.debug("Calibration no-op | param={} | value={} | raw_target={}", key.paramName(), value, rawTarget);
            return;
        }
        out.add(new ParameterChange(key, value, next, reason, inputs.overallAccuracy(), inputs.totalVerified()));
    }

    /**
     * Mean-reverting step: {@code value + decay * (target - value) + reversion * (default - value)},
     * then limited by {@link ParameterKey#step}.
     */
    static double damped(ParameterKey key, double value, double rawTarget, ParameterSet current) {
        double decay = current.get(ParameterKey.CALIBRATION_DECAY);
        double reversion = current.get(ParameterKey.CALIBRATION_REVERSION_RATE);
        double target = value + decay * (rawTarget - value) + reversion * (key.defaultValue() - value);
        return round4(key.step(value, target));
    }

    static Double pearson(double[] x, double[] y) {
        int n = x.length;
        if (n < 2 || y.length != n) {
            return null;
        }
        double mx = 0;
        double my = 0;
        for (int i = 0; i < n; i++) {
            mx += x[i];
            my += y[i];
        }
        mx /= n;
        my /= n;
        double cov = 0;
        double vx = 0;
        double vy = 0;
        for (int i = 0; i < n; i++) {
            cov += (x[i] - mx) * (y[i] - my);
            vx += (x[i] - mx) * (x[i] - mx);
            vy += (y[i] - my) * (y[i] - my);
        }
        if (vx == 0 || vy == 0) {
            return null;
        }
        return cov / Math.sqrt(vx * vy);
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
