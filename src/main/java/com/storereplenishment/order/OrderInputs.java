package com.storereplenishment.order;

import lombok.Builder;

/**
 * @param maxStockQty ceiling on stock + pending + order, {@code null} when the category has none
 * @param stopReason  category rule that forbids ordering today, {@code null} when none applies
 */
@Builder(toBuilder = true)
public record OrderInputs(
    String itemId,
    double adjustedForecast,
    double safetyStock,
    int stockQty,
    int pendingQty,
    int orderUnit,
    int maxMultiplier,
    Double maxStockQty,
    String stopReason
) {}
