package com.storereplenishment.order;

public record CapCandidate(String itemId, int orderQty, int dataDays, double forecast, int recentZeroSaleStreak) {}
