package com.storereplenishment.category;

import com.storereplenishment.domain.CategoryProfile;

import java.time.LocalDate;

/** Per-item inputs a category strategy may look at. */
public record CategoryContext(
    String itemId,
    LocalDate targetDate,
    CategoryProfile profile,
    double dailyAverage,
    double trendCoefficient,
    int stockQty,
    int pendingQty,
    int orderUnit,
    int shelfLifeDays
) {
    public int onHand() {
        return stockQty + pendingQty;
    }
}
