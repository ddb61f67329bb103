package com.storereplenishment.service;

import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.InventorySnapshot;

/**
 * Final per-item outcome of a run after evaluation, the daily cap and the
 * order-time inventory recheck.
 *
 * @param orderTime inventory re-read just before submission, {@code null} when no order was placed
 */
public record ItemDecision(
    String itemId,
    Decision decision,
    int finalQty,
    String reason,
    double exposureDays,
    double popularity,
    double stockoutFrequency,
    boolean upgraded,
    InventorySnapshot orderTime
) {
    public ItemDecision withQty(int qty, String newReason) {
        return new ItemDecision(itemId, decision, qty, newReason, exposureDays, popularity,
            stockoutFrequency, upgraded, orderTime);
    }

    public ItemDecision withOrderTime(InventorySnapshot snapshot, int qty) {
        return new ItemDecision(itemId, decision, qty, reason, exposureDays, popularity,
            stockoutFrequency, upgraded, snapshot);
    }
}
