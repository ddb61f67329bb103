package com.storereplenishment.domain;

public record ProductInfo(
    String itemId,
    String itemName,
    String categoryCode,
    int shelfLifeDays,
    int orderUnit,
    double marginRate,
    boolean excluded,
    String exclusionReason
) {
    public ProductInfo {
        orderUnit = Math.max(1, orderUnit);
    }
}
