package com.storereplenishment.category;

import com.storereplenishment.TestFixtures;
import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.CategoryProfile;
import com.storereplenishment.forecast.SeasonalTrendAdjuster;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CategoryRuleResolverTest {

    private static final LocalDate TARGET = LocalDate.of(2026, 3, 10);

    private final CategoryRuleResolver resolver = TestFixtures.categoryRuleResolver();

    @Test
    void resolve_mapsCategoryCodesToGroups() {
        assertThat(resolver.resolve("049").group()).isEqualTo(CategoryGroup.BEER);
        assertThat(resolver.resolve("050").group()).isEqualTo(CategoryGroup.SOJU);
        assertThat(resolver.resolve(" 072 ").group()).isEqualTo(CategoryGroup.TOBACCO);
        assertThat(resolver.resolve("001").group()).isEqualTo(CategoryGroup.FOOD);
        assertThat(resolver.resolve("053").group()).isEqualTo(CategoryGroup.ALCOHOL_GENERAL);
        assertThat(resolver.resolve("026").group()).isEqualTo(CategoryGroup.PERISHABLE);
        assertThat(resolver.resolve("033").group()).isEqualTo(CategoryGroup.INSTANT_MEAL);
        assertThat(resolver.resolve("014").group()).isEqualTo(CategoryGroup.DESSERT);
        assertThat(resolver.resolve("086").group()).isEqualTo(CategoryGroup.DAILY_NECESSITY);
        assertThat(resolver.resolve("061").group()).isEqualTo(CategoryGroup.GENERAL_MERCHANDISE);
    }

    @Test
    void resolve_unknownOrMissingCodeFallsBackToGeneral() {
        assertThat(resolver.resolve("999").group()).isEqualTo(CategoryGroup.GENERAL);
        assertThat(resolver.resolve(null).group()).isEqualTo(CategoryGroup.GENERAL);
    }

    @Test
    void forGroup_findsRegisteredStrategy() {
        assertThat(resolver.forGroup(CategoryGroup.FOOD)).isPresent();
        assertThat(resolver.forGroup(CategoryGroup.FOOD).get().categoryCodes()).contains("001", "012");
    }

    @Test
    void constructor_rejectsDuplicateCodes() {
        BeerStrategy duplicate = new BeerStrategy() {
            @Override
            public CategoryGroup group() {
                return CategoryGroup.SNACK;
            }
        };

        assertThatThrownBy(() -> new CategoryRuleResolver(
            List.of(new BeerStrategy(), duplicate, new GeneralStrategy()),
            new WeekdayCoefficientLearner(), new SeasonalTrendAdjuster()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("049");
    }

    @Test
    void constructor_requiresCatchAllStrategy() {
        assertThatThrownBy(() -> new CategoryRuleResolver(
            List.of(new BeerStrategy()), new WeekdayCoefficientLearner(), new SeasonalTrendAdjuster()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void profile_usesStrategyDefaultsWhenHistoryIsShort() {
        CategoryStrategy beer = resolver.resolve("049");

        CategoryProfile profile = resolver.profile(beer, TestFixtures.history(TARGET, 5, 3), TARGET);

        assertThat(profile.weekdayLearned()).isFalse();
        assertThat(profile.weekdayCoefficients()).isEqualTo(beer.defaultWeekdayCoefficients());
        assertThat(profile.seasonalCoefficients()).hasSize(12);
    }

    @Test
    void profile_prefersLearnedWeekdayCoefficients() {
        CategoryProfile profile = resolver.profile(resolver.resolve("015"),
            TestFixtures.history(TARGET, 28, 10, 10, 10, 10, 20, 20, 10), TARGET);

        assertThat(profile.weekdayLearned()).isTrue();
        assertThat(profile.group()).isEqualTo(CategoryGroup.SNACK);
    }
}
