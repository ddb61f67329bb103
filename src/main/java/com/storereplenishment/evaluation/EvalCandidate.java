package com.storereplenishment.evaluation;

import lombok.Builder;

@Builder
public record EvalCandidate(
    String itemId,
    double dailyAverage,
    int stockQty,
    int pendingQty,
    double sellDayRatio,
    Double trendRatio,
    double stockoutFrequency,
    boolean excluded,
    String exclusionReason,
    int orderQty,
    int orderUnit
) {}
