package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.SafetyPolicy;
import org.springframework.stereotype.Component;

import java.time.Month;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

@Component
public class FrozenIceStrategy extends AbstractCategoryStrategy {

    private static final List<Double> WEEKDAY = List.of(0.90, 0.90, 0.95, 0.95, 1.00, 1.30, 1.40);
    static final double SAFETY_DAYS = 1.5;
    static final double SUMMER_SAFETY_DAYS = 2.0;
    static final double WINTER_SAFETY_DAYS = 1.0;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.FROZEN_ICE;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("021", "034", "100");
    }

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return WEEKDAY;
    }

    @Override
    public SafetyPolicy safetyPolicy(CategoryContext context) {
        Month month = context.targetDate().getMonth();
        if (month == Month.JUNE || month == Month.JULY || month == Month.AUGUST) {
            return SafetyPolicy.fixed(SUMMER_SAFETY_DAYS);
        }
        if (month == Month.DECEMBER || month == Month.JANUARY || month == Month.FEBRUARY) {
            return SafetyPolicy.fixed(WINTER_SAFETY_DAYS);
        }
        return SafetyPolicy.fixed(SAFETY_DAYS);
    }

    @Override
    protected OptionalDouble maxStockDays() {
        return OptionalDouble.of(7.0);
    }
}
