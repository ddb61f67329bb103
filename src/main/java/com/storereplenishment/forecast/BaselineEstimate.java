package com.storereplenishment.forecast;

import com.storereplenishment.domain.ConfidenceTier;

public record BaselineEstimate(
    double dailyDemand,
    ConfidenceTier tier,
    double weightedMovingAverage,
    Double exponentialAverage,
    Double sameWeekdayAverage
) {}
