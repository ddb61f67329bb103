package com.storereplenishment.evaluation;

import com.storereplenishment.domain.Decision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Labels each candidate order with a risk class. Popularity thresholds come from
 * the distribution of the batch being evaluated, not from fixed numbers.
 */
@Slf4j
@Component
public class PreOrderEvaluator {

    static final double NO_DEMAND_EXPOSURE = 999.0;
    static final double MIN_FORCE_DAILY_AVG = 0.1;
    static final int MIN_ITEMS_FOR_PERCENTILE = 10;
    static final double HIGH_PERCENTILE = 70.0;
    static final double LOW_PERCENTILE = 35.0;
    static final double FALLBACK_HIGH = 0.6;
    static final double FALLBACK_LOW = 0.3;
    static final double MIN_THRESHOLD_GAP = 0.05;

    public EvaluationBatch evaluate(List<EvalCandidate> candidates, EvalParameters params) {
        double maxAverage = candidates.stream().mapToDouble(EvalCandidate::dailyAverage).max().orElse(0.0);

        double[] popularity = new double[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            popularity[i] = popularity(candidates.get(i), maxAverage, params);
        }
        double[] thresholds = thresholds(popularity);
        double high = thresholds[0];
        double low = thresholds[1];

        List<EvaluationResult> results = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            results.add(classify(candidates.get(i), popularity[i], high, low, params));
        }
        log.info("Pre-order evaluation | items={} | highPopularity={} | lowPopularity={}",
                 candidates.size(), round(high), round(low));
        return new EvaluationBatch(results, high, low);
    }

    EvaluationResult classify(EvalCandidate c, double popularity, double high, double low, EvalParameters params) {
        double exposure = exposureDays(c);
        if (c.excluded()) {
            return new EvaluationResult(c.itemId(), Decision.SKIP, 0, exposure, popularity,
                                        c.stockoutFrequency(), false, c.exclusionReason());
        }

        Decision decision;
        String reason;
        if (c.stockQty() <= 0) {
            if (c.dailyAverage() < MIN_FORCE_DAILY_AVG) {
                decision = Decision.NORMAL_ORDER;
                reason = "out of stock, negligible demand";
            } else {
                decision = Decision.FORCE_ORDER;
                reason = "out of stock";
            }
        } else if (exposure < params.exposureUrgent()) {
            decision = Decision.URGENT_ORDER;
            reason = String.format("exposure %.2f days < %.2f", exposure, params.exposureUrgent());
        } else if (exposure < params.exposureNormal()) {
            decision = Decision.NORMAL_ORDER;
            reason = String.format("exposure %.2f days < %.2f", exposure, params.exposureNormal());
        } else if (exposure >= params.exposureSufficient()) {
            decision = popularity >= high ? Decision.NORMAL_ORDER : Decision.PASS;
            reason = String.format("sufficient stock %.2f days, popularity %.2f", exposure, popularity);
        } else {
            decision = popularity < low ? Decision.PASS : Decision.NORMAL_ORDER;
            reason = String.format("exposure %.2f days, popularity %.2f", exposure, popularity);
        }

        boolean upgraded = false;
        if (c.stockoutFrequency() > params.stockoutFreqThreshold() && exposure < params.exposureNormal()) {
            Decision raised = decision.upgrade();
            if (raised != decision) {
                upgraded = true;
                reason = reason + String.format("; stockout frequency %.2f upgraded %s", c.stockoutFrequency(), decision);
                decision = raised;
            }
        }

        return new EvaluationResult(c.itemId(), decision, finalQty(decision, c), exposure, popularity,
                                    c.stockoutFrequency(), upgraded, reason);
    }

    double popularity(EvalCandidate c, double maxAverage, EvalParameters params) {
        double normAverage = maxAverage > 0 ? c.dailyAverage() / maxAverage : 0.0;
        double trend = c.trendRatio() != null ? c.trendRatio() : 1.0;
        double trendScore = clamp((trend - 0.5) / 1.0, 0.0, 1.0);
        return params.weightDailyAvg() * normAverage
            + params.weightSellDayRatio() * c.sellDayRatio()
            + params.weightTrend() * trendScore;
    }

    double exposureDays(EvalCandidate c) {
        if (c.dailyAverage() <= 0) {
            return NO_DEMAND_EXPOSURE;
        }
        return (c.stockQty() + c.pendingQty()) / c.dailyAverage();
    }

    /** [high, low] popularity thresholds for the batch. */
    double[] thresholds(double[] popularity) {
        if (popularity.length < MIN_ITEMS_FOR_PERCENTILE) {
            return new double[]{FALLBACK_HIGH, FALLBACK_LOW};
        }
        double[] sorted = popularity.clone();
        Arrays.sort(sorted);
        double high = percentile(sorted, HIGH_PERCENTILE);
        double low = percentile(sorted, LOW_PERCENTILE);
        if (high - low < MIN_THRESHOLD_GAP) {
            low = Math.max(0.0, high - MIN_THRESHOLD_GAP);
        }
        return new double[]{high, low};
    }

    private static int finalQty(Decision decision, EvalCandidate c) {
        if (decision == Decision.SKIP || decision == Decision.PASS) {
            return 0;
        }
        if (decision == Decision.FORCE_ORDER) {
            return Math.max(c.orderQty(), Math.max(1, c.orderUnit()));
        }
        return c.orderQty();
    }

    static double percentile(double[] sorted, double pct) {
        double rank = pct / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private static double round(double v) {
        return Math.round(v * 10000.0) / 10000.0;
    }
}
