package com.storereplenishment.forecast;

/**
 * Receiving and discard totals over the disuse lookback window.
 *
 * @param batchLevel whether {@code batchCount} counts real receiving batches; when false
 *                   the sample is judged by calendar days instead
 */
public record DisuseStats(int receivedQty, int disusedQty, int calendarDays, int batchCount, boolean batchLevel) {

    public static DisuseStats empty() {
        return new DisuseStats(0, 0, 0, 0, false);
    }

    public boolean hasData() {
        return receivedQty > 0;
    }

    public double rate() {
        return receivedQty > 0 ? Math.min(1.0, (double) disusedQty / receivedQty) : 0.0;
    }
}
