package com.storereplenishment.evaluation;

import com.storereplenishment.domain.OutcomeClass;

import java.time.LocalDate;
import java.util.Map;

public record VerificationResult(
    LocalDate evalDate,
    int verified,
    int alreadyVerified,
    int missingActuals,
    Map<OutcomeClass, Integer> byOutcome
) {}
