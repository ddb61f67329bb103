package com.storereplenishment.domain;

public enum InventorySource {
    LIVE,
    CACHE,
    FALLBACK
}
