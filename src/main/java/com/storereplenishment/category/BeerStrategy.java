package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
public class BeerStrategy extends AlcoholStrategy {

    private static final List<Double> WEEKDAY = List.of(1.15, 1.22, 1.21, 1.37, 2.54, 2.37, 0.97);

    @Override
    public CategoryGroup group() {
        return CategoryGroup.BEER;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("049");
    }

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return WEEKDAY;
    }
}
