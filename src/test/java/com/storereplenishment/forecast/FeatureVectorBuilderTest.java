package com.storereplenishment.forecast;

import com.storereplenishment.TestFixtures;
import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.feature.FeatureEngine;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureVectorBuilderTest {

    private static final LocalDate TARGET = LocalDate.of(2026, 3, 10);

    private final FeatureVectorBuilder builder = new FeatureVectorBuilder();

    @Test
    void build_matchesDeclaredFeatureNames() {
        FeatureVectorBuilder.FeatureInput input = new FeatureVectorBuilder.FeatureInput("I-1", TARGET,
            new FeatureEngine().compute(TestFixtures.history(TARGET, 30, 4), TARGET),
            CategoryGroup.FOOD, true, 2, 1, 0.35);

        double[] vector = builder.build(input);

        assertThat(vector).hasSize(builder.featureCount());
        assertThat(vector[FeatureVectorBuilder.FEATURE_NAMES.indexOf("lag_1")]).isEqualTo(4.0);
        assertThat(vector[FeatureVectorBuilder.FEATURE_NAMES.indexOf("lag_365")]).isZero();
        assertThat(vector[FeatureVectorBuilder.FEATURE_NAMES.indexOf("promotion")]).isEqualTo(1.0);
        assertThat(vector[FeatureVectorBuilder.FEATURE_NAMES.indexOf("cat_food")]).isEqualTo(1.0);
        assertThat(vector[FeatureVectorBuilder.FEATURE_NAMES.indexOf("cat_snack")]).isZero();
        assertThat(vector[FeatureVectorBuilder.FEATURE_NAMES.indexOf("margin_rate")]).isEqualTo(0.35);
    }
}
