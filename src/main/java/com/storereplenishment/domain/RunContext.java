package com.storereplenishment.domain;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Everything a run reads that could change between runs. Built once before the
 * first item and shared, unchanged, by every component of the run.
 */
public record RunContext(
    UUID runId,
    String storeId,
    LocalDate targetDate,
    boolean dryRun,
    PendingMode pendingMode,
    ParameterSet parameters,
    BlendSettings blend,
    OrderSettings order,
    CapSettings dailyCap,
    DisuseSettings disuse
) {

    public double param(ParameterKey key) {
        return parameters.get(key);
    }

    public record BlendSettings(
        boolean modelEnabled,
        int minSamples,
        int fullWeightDays,
        double partialModelWeight,
        double fullModelWeight
    ) {}

    public record OrderSettings(
        int maxMultiplier,
        int pendingHistoryDays,
        int simplifiedLookbackDays
    ) {}

    public record CapSettings(
        int wasteBuffer,
        int lookbackDays,
        int minSameWeekdaySamples,
        double exploreRatio,
        double fallbackDailyAvg,
        int provenMinDataDays,
        int exploreFailZeroDays
    ) {}

    public record DisuseSettings(
        int lookbackDays,
        int minBatchCount,
        int minCalendarDays,
        double itemWeight,
        double absoluteFloor
    ) {}
}
