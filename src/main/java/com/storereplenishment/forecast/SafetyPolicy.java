package com.storereplenishment.forecast;

/**
 * How a category sizes its safety stock. A fixed day count replaces the shelf-life,
 * turnover and volatility formula entirely.
 */
public record SafetyPolicy(Double fixedDays, boolean disuseDiscount, double floorDays, double ceilingDays) {

    public static SafetyPolicy shelfLife(double floorDays, double ceilingDays) {
        return new SafetyPolicy(null, false, floorDays, ceilingDays);
    }

    public static SafetyPolicy perishable(double floorDays, double ceilingDays) {
        return new SafetyPolicy(null, true, floorDays, ceilingDays);
    }

    public static SafetyPolicy fixed(double days) {
        return new SafetyPolicy(days, false, 0.0, days);
    }

    /** A fixed day count that is still discounted by the category discard rate. */
    public static SafetyPolicy perishableFixed(double days) {
        return new SafetyPolicy(days, true, 0.0, days);
    }
}
