package com.storereplenishment.config;

import com.storereplenishment.domain.PendingMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Static engine settings bound from {@code engine.*}. Values are copied into a
 * {@link com.storereplenishment.domain.RunContext} at the start of every run.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private String storeId = "default";

    private int inventoryCacheTtlMinutes = 60;

    private Pending pending = new Pending();

    private Order order = new Order();

    private Blend blend = new Blend();

    private DailyCap dailyCap = new DailyCap();

    private Disuse disuse = new Disuse();

    private Calibration calibration = new Calibration();

    @Getter
    @Setter
    public static class Pending {
        private PendingMode mode = PendingMode.AGGREGATE;
        private int historyDays = 7;
        private int simplifiedLookbackDays = 3;
    }

    @Getter
    @Setter
    public static class Order {
        private int maxMultiplier = 99;
    }

    @Getter
    @Setter
    public static class Blend {
        private int minSamples = 30;
        private int fullWeightDays = 60;
        private double partialModelWeight = 0.30;
        private double fullModelWeight = 0.50;
    }

    @Getter
    @Setter
    public static class DailyCap {
        private int wasteBuffer = 3;
        private int lookbackDays = 21;
        private int minSameWeekdaySamples = 2;
        private double exploreRatio = 0.25;
        private double fallbackDailyAvg = 15;
        private int provenMinDataDays = 6;
        private int exploreFailZeroDays = 3;
    }

    @Getter
    @Setter
    public static class Disuse {
        private int lookbackDays = 30;
        private int minBatchCount = 14;
        private int minCalendarDays = 7;
        private double itemWeight = 0.8;
        /** Lowest coefficient ever applied, whatever the calibrated floor says. */
        private double absoluteFloor = 0.5;
    }

    @Getter
    @Setter
    public static class Calibration {
        private int minSamples = 50;
        private int maxParamsPerCycle = 3;
        private int accuracyWindowDays = 30;
    }
}
