package com.storereplenishment.domain;

import java.time.LocalDate;
import java.util.Map;

public record Promotion(String type, LocalDate startDate, LocalDate endDate) {

    private static final Map<String, Integer> PURCHASE_MULTIPLES = Map.of(
        "1+1", 2,
        "2+1", 3
    );

    public boolean isActiveOn(LocalDate date) {
        if (type == null || date == null) {
            return false;
        }
        boolean started = startDate == null || !date.isBefore(startDate);
        boolean notEnded = endDate == null || !date.isAfter(endDate);
        return started && notEnded;
    }

    /** Units a customer must buy to use the promotion, 0 when the type carries no minimum. */
    public int purchaseMultiple() {
        return type == null ? 0 : PURCHASE_MULTIPLES.getOrDefault(type.trim(), 0);
    }
}
