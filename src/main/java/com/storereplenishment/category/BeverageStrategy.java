package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

@Component
public class BeverageStrategy extends AbstractCategoryStrategy {

    private static final List<Double> WEEKDAY = List.of(0.95, 0.95, 1.00, 1.00, 1.00, 1.15, 1.10);

    @Override
    public CategoryGroup group() {
        return CategoryGroup.BEVERAGE;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("010", "039", "043", "044", "045", "048");
    }

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return WEEKDAY;
    }

    @Override
    protected OptionalDouble maxStockDays() {
        return OptionalDouble.of(7.0);
    }
}
