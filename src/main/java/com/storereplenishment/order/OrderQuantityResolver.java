package com.storereplenishment.order;

import com.storereplenishment.domain.InventorySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns forecast, safety stock, stock on hand and pending units into an order that
 * is a whole number of order units.
 */
@Slf4j
@Component
public class OrderQuantityResolver {

    static final double NOISE_THRESHOLD = 0.5;
    static final double ROUND_UP_FRACTION = 0.3;
    static final int SHORT_LIFE_GUARD_DAYS = 1;

    public OrderQuantity resolve(OrderInputs in) {
        double need = in.adjustedForecast() + in.safetyStock() - in.stockQty() - in.pendingQty();
        if (in.stopReason() != null) {
            return OrderQuantity.none(need, in.stopReason());
        }
        if (need < NOISE_THRESHOLD) {
            return OrderQuantity.none(need, need <= 0 ? "covered by stock" : "need below noise threshold");
        }

        int pieces;
        if (need < 1.0) {
            pieces = 1;
        } else {
            double whole = Math.floor(need);
            pieces = (int) whole + (need - whole >= ROUND_UP_FRACTION ? 1 : 0);
        }

        int unit = Math.max(1, in.orderUnit());
        int units = (int) Math.ceil((double) pieces / unit);
        units = clamp(units, 1, Math.max(1, in.maxMultiplier()));

        if (in.maxStockQty() != null) {
            double room = in.maxStockQty() - in.stockQty() - in.pendingQty();
            int fitting = (int) Math.floor(room / unit);
            if (fitting <= 0) {
                return OrderQuantity.none(need, String.format("max stock %.1f reached", in.maxStockQty()));
            }
            units = Math.min(units, fitting);
        }
        return new OrderQuantity(units * unit, units, need, null);
    }

    /**
     * Re-checks an order against the order-time inventory view. A recalculated order
     * smaller than the original is kept at the original size when only the pending
     * figure grew and the item is food that cannot be re-ordered the same day.
     */
    public int guardRecalculation(String itemId, int originalQty, int recalculatedQty,
                                  InventorySnapshot predictionTime, InventorySnapshot orderTime,
                                  int shelfLifeDays, boolean perishable) {
        if (recalculatedQty >= originalQty) {
            return recalculatedQty;
        }
        boolean pendingOnly = predictionTime.stockQty() == orderTime.stockQty()
            && orderTime.pendingQty() > predictionTime.pendingQty();
        if (pendingOnly && perishable && shelfLifeDays <= SHORT_LIFE_GUARD_DAYS) {
            log.info("Short-life order kept | item={} | original={} | recalculated={} | pending {} -> {}",
                     itemId, originalQty, recalculatedQty, predictionTime.pendingQty(), orderTime.pendingQty());
            return originalQty;
        }
        return recalculatedQty;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
