package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class GeneralStrategy extends AbstractCategoryStrategy {

    @Override
    public CategoryGroup group() {
        return CategoryGroup.GENERAL;
    }

    @Override
    public Set<String> categoryCodes() {
        return Set.of();
    }
}
