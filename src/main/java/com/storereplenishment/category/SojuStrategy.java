package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
public class SojuStrategy extends AlcoholStrategy {

    private static final List<Double> WEEKDAY = List.of(0.83, 0.89, 0.90, 1.09, 1.18, 1.19, 0.91);

    @Override
    public CategoryGroup group() {
        return CategoryGroup.SOJU;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("050");
    }

    @Override
    public List<Double> defaultWeekdayCoefficients() {
        return WEEKDAY;
    }
}
