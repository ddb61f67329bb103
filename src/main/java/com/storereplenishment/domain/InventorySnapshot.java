package com.storereplenishment.domain;

import java.time.Instant;

/**
 * Point-in-time stock view for one item, carrying where the figure came from and
 * whether it outlived the cache time-to-live.
 */
public record InventorySnapshot(
    int stockQty,
    int pendingQty,
    InventorySource source,
    boolean stale,
    Instant observedAt
) {
    public InventorySnapshot {
        stockQty = Math.max(0, stockQty);
        pendingQty = Math.max(0, pendingQty);
    }

    public InventorySnapshot withPending(int pending) {
        return new InventorySnapshot(stockQty, pending, source, stale, observedAt);
    }

    public static InventorySnapshot missing() {
        return new InventorySnapshot(0, 0, InventorySource.FALLBACK, true, null);
    }
}
