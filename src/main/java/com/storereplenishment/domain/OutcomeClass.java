package com.storereplenishment.domain;

public enum OutcomeClass {
    CORRECT,
    UNDER_ORDER,
    OVER_ORDER,
    MISS
}
