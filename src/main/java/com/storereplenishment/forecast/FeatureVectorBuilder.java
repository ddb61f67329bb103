package com.storereplenishment.forecast;

import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.feature.SalesFeatures;
import com.storereplenishment.feature.WindowStats;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The one definition of the demand model's input vector. Training-set export and
 * live inference both go through {@link #build}, so a feature can never be computed
 * one way for training and another way for prediction.
 */
@Component
public class FeatureVectorBuilder {

    public static final List<String> FEATURE_NAMES;

    static {
        List<String> names = new ArrayList<>(List.of(
            "lag_1", "lag_7", "lag_14", "lag_28", "lag_365",
            "roll_mean_7", "roll_mean_14", "roll_mean_28", "roll_mean_90",
            "roll_std_7", "roll_std_28", "roll_max_7",
            "ewm_7", "ewm_14",
            "same_weekday_avg", "trend_ratio",
            "weekday_sin", "weekday_cos", "month_sin", "month_cos",
            "promotion"
        ));
        for (CategoryGroup group : CategoryGroup.values()) {
            names.add("cat_" + group.name().toLowerCase());
        }
        names.addAll(List.of("shelf_life_days", "order_unit", "margin_rate"));
        FEATURE_NAMES = Collections.unmodifiableList(names);
    }

    public int featureCount() {
        return FEATURE_NAMES.size();
    }

    public double[] build(FeatureInput input) {
        SalesFeatures f = input.features();
        LocalDate date = input.targetDate();
        double[] v = new double[FEATURE_NAMES.size()];
        int i = 0;

        v[i++] = orZero(f.lag(1));
        v[i++] = orZero(f.lag(7));
        v[i++] = orZero(f.lag(14));
        v[i++] = orZero(f.lag(28));
        v[i++] = orZero(f.lag(365));
        v[i++] = orZero(f.rollingMean(7));
        v[i++] = orZero(f.rollingMean(14));
        v[i++] = orZero(f.rollingMean(28));
        v[i++] = orZero(f.rollingMean(90));
        v[i++] = std(f.window(7));
        v[i++] = std(f.window(28));
        v[i++] = f.window(7) != null ? f.window(7).max() : 0.0;
        v[i++] = orZero(f.ewm(7));
        v[i++] = orZero(f.ewm(14));
        v[i++] = orZero(f.sameWeekdayAverage());
        v[i++] = f.trendRatio() != null ? f.trendRatio() : 1.0;

        double weekday = date.getDayOfWeek().getValue() - 1;
        double month = date.getMonthValue() - 1;
        v[i++] = Math.sin(2 * Math.PI * weekday / 7);
        v[i++] = Math.cos(2 * Math.PI * weekday / 7);
        v[i++] = Math.sin(2 * Math.PI * month / 12);
        v[i++] = Math.cos(2 * Math.PI * month / 12);
        v[i++] = input.promotionActive() ? 1.0 : 0.0;

        for (CategoryGroup group : CategoryGroup.values()) {
            v[i++] = group == input.group() ? 1.0 : 0.0;
        }

        v[i++] = input.shelfLifeDays();
        v[i++] = input.orderUnit();
        v[i] = input.marginRate();
        return v;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static double std(WindowStats stats) {
        return stats != null ? stats.std() : 0.0;
    }

    public record FeatureInput(
        String itemId,
        LocalDate targetDate,
        SalesFeatures features,
        CategoryGroup group,
        boolean promotionActive,
        int shelfLifeDays,
        int orderUnit,
        double marginRate
    ) {}
}
