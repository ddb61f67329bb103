package com.storereplenishment.collector;

import com.storereplenishment.domain.InventorySnapshot;
import com.storereplenishment.domain.ProductInfo;
import com.storereplenishment.domain.Promotion;
import com.storereplenishment.domain.SalesRecord;
import com.storereplenishment.forecast.DisuseStats;
import com.storereplenishment.order.DailyOrderCount;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the external data collector. Calls block; any failure surfaces as a
 * runtime exception that the batch handles per item.
 */
public interface StoreDataGateway {

    List<ProductInfo> products();

    /** Records dated within {@code [from, to]}, oldest first. */
    List<SalesRecord> salesHistory(String storeId, String itemId, LocalDate from, LocalDate to);

    InventorySnapshot inventory(String storeId, String itemId, LocalDate today);

    Optional<Promotion> activePromotion(String storeId, String itemId, LocalDate date);

    /** Category-wide receiving and discard totals for dates within {@code [from, to)}. */
    DisuseStats categoryDisuse(String storeId, Collection<String> categoryCodes, LocalDate from, LocalDate to);

    /** Distinct ordered items per date for dates within {@code [from, to)}. */
    List<DailyOrderCount> orderedItemCounts(String storeId, Collection<String> categoryCodes, LocalDate from, LocalDate to);
}
