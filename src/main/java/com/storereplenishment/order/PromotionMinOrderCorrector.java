package com.storereplenishment.order;

import com.storereplenishment.domain.Promotion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Raises a positive order to the purchase multiple of an active buy-N-get-M
 * promotion. Runs after unit rounding and keeps the result on the order unit.
 */
@Slf4j
@Component
public class PromotionMinOrderCorrector {

    public int correct(String itemId, int orderQty, Promotion promotion, int orderUnit, LocalDate date) {
        if (orderQty <= 0 || promotion == null || !promotion.isActiveOn(date)) {
            return orderQty;
        }
        int multiple = promotion.purchaseMultiple();
        if (multiple <= 0 || orderQty >= multiple) {
            return orderQty;
        }
        int unit = Math.max(1, orderUnit);
        int corrected = (int) Math.ceil((double) multiple / unit) * unit;
        log.info("Promotion minimum applied | item={} | promo={} | qty={} -> {}",
                 itemId, promotion.type(), orderQty, corrected);
        return corrected;
    }
}
