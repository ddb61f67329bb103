package com.storereplenishment.evaluation;

import com.storereplenishment.domain.Decision;

public record EvaluationResult(
    String itemId,
    Decision decision,
    int finalQty,
    double exposureDays,
    double popularity,
    double stockoutFrequency,
    boolean upgraded,
    String reason
) {}
