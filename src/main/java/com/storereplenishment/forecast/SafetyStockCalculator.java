package com.storereplenishment.forecast;

import com.storereplenishment.domain.ShelfLifeGroup;
import org.springframework.stereotype.Component;

/**
 * Safety stock in days of average demand: a shelf-life buffer scaled by turnover
 * and by sales volatility, then discounted by the discard coefficient for perishables.
 */
@Component
public class SafetyStockCalculator {

    public SafetyStock calculate(SafetyPolicy policy, int shelfLifeDays, double dailyAverage,
                                 double coefficientOfVariation, double disuseCoefficient) {
        ShelfLifeGroup group = ShelfLifeGroup.of(shelfLifeDays);
        double average = Math.max(0.0, dailyAverage);

        if (policy.fixedDays() != null) {
            double disuse = policy.disuseDiscount() ? disuseCoefficient : 1.0;
            double days = policy.fixedDays() * disuse;
            return new SafetyStock(days, days * average, group, policy.fixedDays(), 1.0, 1.0, disuse);
        }

        double baseDays = group.safetyDays(shelfLifeDays);
        double turnover = turnoverMultiplier(average);
        double volatility = volatilityMultiplier(coefficientOfVariation);
        double disuse = policy.disuseDiscount() ? disuseCoefficient : 1.0;

        double days = baseDays * turnover * volatility * disuse;
        days = Math.max(policy.floorDays(), Math.min(policy.ceilingDays(), days));
        return new SafetyStock(days, days * average, group, baseDays, turnover, volatility, disuse);
    }

    public double turnoverMultiplier(double dailyAverage) {
        if (dailyAverage >= 5.0) {
            return 1.5;
        }
        if (dailyAverage >= 2.0) {
            return 1.2;
        }
        return 0.8;
    }

    public double volatilityMultiplier(double cv) {
        if (cv < 0.3) {
            return 1.0;
        }
        if (cv < 0.5) {
            return 1.2;
        }
        if (cv < 0.8) {
            return 1.5;
        }
        return 2.0;
    }
}
