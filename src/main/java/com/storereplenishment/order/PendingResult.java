package com.storereplenishment.order;

import com.storereplenishment.domain.PendingMode;

/**
 * @param source        algorithm whose figure is used for ordering
 * @param naiveQty      per-row sum the aggregate algorithm corrects, for diagnosis
 * @param comparisonQty simplified figure when running in comparison mode
 */
public record PendingResult(int pendingQty, PendingMode source, int naiveQty, Integer comparisonQty) {

    public boolean corrected() {
        return source == PendingMode.AGGREGATE && naiveQty != pendingQty;
    }
}
