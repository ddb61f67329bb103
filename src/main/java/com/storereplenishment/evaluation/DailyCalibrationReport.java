package com.storereplenishment.evaluation;

import java.util.List;

public record DailyCalibrationReport(
    List<ParameterChange> clamped,
    VerificationResult verification,
    CalibrationResult calibration
) {}
