package com.storereplenishment.service;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.forecast.DisuseStats;
import com.storereplenishment.forecast.ModelStatus;
import com.storereplenishment.order.PendingComparisonStats;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/** Per-run state shared between items: model check result, comparison counters, category caches. */
public final class RunScope {

    private final ModelStatus modelStatus;
    private final PendingComparisonStats pendingStats = new PendingComparisonStats();
    private final Map<CategoryGroup, DisuseStats> categoryDisuse = new ConcurrentHashMap<>();

    public RunScope(ModelStatus modelStatus) {
        this.modelStatus = modelStatus;
    }

    public ModelStatus modelStatus() {
        return modelStatus;
    }

    public PendingComparisonStats pendingStats() {
        return pendingStats;
    }

    public DisuseStats categoryDisuse(CategoryGroup group, Function<CategoryGroup, DisuseStats> loader) {
        return categoryDisuse.computeIfAbsent(group, loader);
    }
}
