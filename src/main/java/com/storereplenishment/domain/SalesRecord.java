package com.storereplenishment.domain;

import java.time.LocalDate;

/**
 * One day's sales, order, receipt, discard and closing-stock snapshot for one item.
 * Written by the external collector and never changed afterwards.
 */
public record SalesRecord(
    LocalDate date,
    String itemId,
    int saleQty,
    int orderQty,
    int receiveQty,
    int disuseQty,
    int stockQty
) {
    public boolean isStockout() {
        return stockQty <= 0 && saleQty <= 0;
    }
}
