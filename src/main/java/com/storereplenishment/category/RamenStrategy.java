package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;
import java.util.Set;

@Component
public class RamenStrategy extends AbstractCategoryStrategy {

    @Override
    public CategoryGroup group() {
        return CategoryGroup.RAMEN;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("006", "032");
    }

    @Override
    protected OptionalDouble maxStockDays() {
        return OptionalDouble.of(4.0);
    }
}
