package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.CategoryProfile;
import com.storereplenishment.domain.SalesRecord;
import com.storereplenishment.forecast.SeasonalTrendAdjuster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the strategy for a category code and builds the category profile the
 * strategy applies for one item and date.
 */
@Slf4j
@Component
public class CategoryRuleResolver {

    private final Map<String, CategoryStrategy> byCode;
    private final Map<CategoryGroup, CategoryStrategy> byGroup;
    private final CategoryStrategy fallback;
    private final WeekdayCoefficientLearner weekdayLearner;
    private final SeasonalTrendAdjuster seasonalTrendAdjuster;

    public CategoryRuleResolver(List<CategoryStrategy> strategies,
                                WeekdayCoefficientLearner weekdayLearner,
                                SeasonalTrendAdjuster seasonalTrendAdjuster) {
        this.weekdayLearner = weekdayLearner;
        this.seasonalTrendAdjuster = seasonalTrendAdjuster;
        Map<String, CategoryStrategy> codes = new HashMap<>();
        Map<CategoryGroup, CategoryStrategy> groups = new EnumMap<>(CategoryGroup.class);
        CategoryStrategy general = null;
        for (CategoryStrategy strategy : strategies) {
            groups.put(strategy.group(), strategy);
            if (strategy.categoryCodes().isEmpty()) {
                general = strategy;
            }
            for (String code : strategy.categoryCodes()) {
                CategoryStrategy previous = codes.put(code, strategy);
                if (previous != null) {
                    throw new IllegalStateException("Category code " + code + " claimed by both "
                        + previous + " and " + strategy);
                }
            }
        }
        if (general == null) {
            throw new IllegalStateException("No catch-all category strategy registered");
        }
        this.byCode = Collections.unmodifiableMap(codes);
        this.byGroup = Collections.unmodifiableMap(groups);
        this.fallback = general;
        log.info("Category strategies registered | codes={} | groups={}", codes.size(), groups.keySet());
    }

    public CategoryStrategy resolve(String categoryCode) {
        if (categoryCode == null) {
            return fallback;
        }
        return byCode.getOrDefault(categoryCode.trim(), fallback);
    }

    public Optional<CategoryStrategy> forGroup(CategoryGroup group) {
        return Optional.ofNullable(byGroup.get(group));
    }

    /** Learned weekday coefficients when the item has enough history, the strategy default otherwise. */
    public CategoryProfile profile(CategoryStrategy strategy, List<SalesRecord> history, LocalDate targetDate) {
        Optional<List<Double>> learned = weekdayLearner.learn(history, targetDate);
        List<Double> weekday = learned.orElse(strategy.defaultWeekdayCoefficients());
        CategoryGroup group = strategy.group();
        return new CategoryProfile(
            group,
            weekday,
            learned.isPresent(),
            seasonalTrendAdjuster.seasonalProfile(group),
            strategy.safetyPolicy(emptyContext(targetDate)).floorDays(),
            strategy.safetyPolicy(emptyContext(targetDate)).ceilingDays()
        );
    }

    public double trendCoefficient(Double shortMean, Double longMean) {
        return seasonalTrendAdjuster.trendCoefficient(shortMean, longMean);
    }

    private static CategoryContext emptyContext(LocalDate targetDate) {
        return new CategoryContext(null, targetDate, null, 0.0, 1.0, 0, 0, 1, 0);
    }
}
