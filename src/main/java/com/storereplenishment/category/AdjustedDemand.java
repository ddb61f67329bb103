package com.storereplenishment.category;

public record AdjustedDemand(
    double baseline,
    double weekdayCoefficient,
    double seasonalCoefficient,
    double trendCoefficient,
    double adjusted
) {}
