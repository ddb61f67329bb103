package com.storereplenishment.evaluation;

import com.storereplenishment.domain.ParameterKey;

public record ParameterChange(
    ParameterKey key,
    double oldValue,
    double newValue,
    String reason,
    Double accuracyBefore,
    int sampleSize
) {}
