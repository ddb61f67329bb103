package com.storereplenishment.evaluation;

import com.storereplenishment.domain.ParameterKey;
import com.storereplenishment.domain.ParameterSet;

/** Evaluator thresholds for one run; popularity weights are normalised to sum to 1. */
public record EvalParameters(
    double weightDailyAvg,
    double weightSellDayRatio,
    double weightTrend,
    double exposureUrgent,
    double exposureNormal,
    double exposureSufficient,
    double stockoutFreqThreshold
) {
    public static EvalParameters from(ParameterSet params) {
        double wAvg = params.get(ParameterKey.WEIGHT_DAILY_AVG);
        double wSell = params.get(ParameterKey.WEIGHT_SELL_DAY_RATIO);
        double wTrend = params.get(ParameterKey.WEIGHT_TREND);
        double sum = wAvg + wSell + wTrend;
        if (sum <= 0) {
            wAvg = ParameterKey.WEIGHT_DAILY_AVG.defaultValue();
            wSell = ParameterKey.WEIGHT_SELL_DAY_RATIO.defaultValue();
            wTrend = ParameterKey.WEIGHT_TREND.defaultValue();
            sum = wAvg + wSell + wTrend;
        }
        return new EvalParameters(
            wAvg / sum,
            wSell / sum,
            wTrend / sum,
            params.get(ParameterKey.EXPOSURE_URGENT),
            params.get(ParameterKey.EXPOSURE_NORMAL),
            params.get(ParameterKey.EXPOSURE_SUFFICIENT),
            params.get(ParameterKey.STOCKOUT_FREQ_THRESHOLD)
        );
    }
}
