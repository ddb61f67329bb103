package com.storereplenishment.order;

public record OrderQuantity(int qty, int units, double need, String reason) {

    public static OrderQuantity none(double need, String reason) {
        return new OrderQuantity(0, 0, need, reason);
    }
}
