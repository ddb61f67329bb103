package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;
import java.util.Set;

@Component
public class SnackStrategy extends AbstractCategoryStrategy {

    @Override
    public CategoryGroup group() {
        return CategoryGroup.SNACK;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of("015", "016", "017", "018", "019", "020", "029", "030");
    }

    @Override
    protected OptionalDouble maxStockDays() {
        return OptionalDouble.of(5.0);
    }
}
