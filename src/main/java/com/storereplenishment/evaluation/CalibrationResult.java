package com.storereplenishment.evaluation;

import java.time.LocalDate;
import java.util.List;

public record CalibrationResult(
    LocalDate calibrationDate,
    int sampleSize,
    double accuracy,
    boolean skipped,
    String skipReason,
    List<ParameterChange> changes
) {
    public static CalibrationResult skipped(LocalDate date, int sampleSize, String reason) {
        return new CalibrationResult(date, sampleSize, 0.0, true, reason, List.of());
    }
}
