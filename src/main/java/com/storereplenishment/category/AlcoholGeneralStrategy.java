package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/** Wine and spirits. Sales pile up toward Sunday, more sharply than beer or soju. */
@Component
public class AlcoholGeneralStrategy extends AlcoholStrategy {

    private static final List<Double> WEEKDAY = List.of(0.80, 0.80, 0.85, 0.90, 1.10, 1.50, 2.00);
    static final double CEILING_DAYS = 10.0;

    @Override
    public CategoryGroup group() {
        return CategoryGroup.ALCOHOL_GENERAL;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("052", "053");
    }

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return WEEKDAY;
    }

    @Override
    protected OptionalDouble maxStockDays() {
        return OptionalDouble.of(CEILING_DAYS);
    }
}
