package com.storereplenishment.forecast;

import com.storereplenishment.domain.ShelfLifeGroup;

public record SafetyStock(
    double days,
    double units,
    ShelfLifeGroup shelfLifeGroup,
    double baseDays,
    double turnoverMultiplier,
    double volatilityMultiplier,
    double disuseCoefficient
) {}
