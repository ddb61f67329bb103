package com.storereplenishment.forecast;

public record BlendResult(
    double forecast,
    double ruleForecast,
    Double modelForecast,
    double modelWeight,
    String fallbackReason
) {
    public static BlendResult ruleOnly(double ruleForecast, String reason) {
        return new BlendResult(ruleForecast, ruleForecast, null, 0.0, reason);
    }

    public boolean blended() {
        return modelForecast != null && modelWeight > 0;
    }
}
