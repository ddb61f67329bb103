package com.storereplenishment.collector;

import com.storereplenishment.config.EngineProperties;
import com.storereplenishment.domain.InventorySnapshot;
import com.storereplenishment.domain.ProductInfo;
import com.storereplenishment.domain.Promotion;
import com.storereplenishment.domain.SalesRecord;
import com.storereplenishment.entity.DailySales;
import com.storereplenishment.entity.ProductMaster;
import com.storereplenishment.forecast.DisuseStats;
import com.storereplenishment.order.DailyOrderCount;
import com.storereplenishment.repository.DailySalesRepository;
import com.storereplenishment.repository.InventoryCacheRepository;
import com.storereplenishment.repository.ProductMasterRepository;
import com.storereplenishment.repository.PromotionRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Reads the tables the collector fills. */
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaStoreDataGateway implements StoreDataGateway {

    private final ProductMasterRepository productRepository;
    private final DailySalesRepository salesRepository;
    private final InventoryCacheRepository inventoryRepository;
    private final PromotionRecordRepository promotionRepository;
    private final InventoryProvenanceResolver provenanceResolver;
    private final EngineProperties properties;

    @Override
    public List<ProductInfo> products() {
        return productRepository.findAllByOrderByItemIdAsc().stream()
            .map(this::toProductInfo)
            .toList();
    }

    @Override
    public List<SalesRecord> salesHistory(String storeId, String itemId, LocalDate from, LocalDate to) {
        return salesRepository.findByStoreIdAndItemIdAndSalesDateBetweenOrderBySalesDateAsc(storeId, itemId, from, to)
            .stream()
            .map(JpaStoreDataGateway::toRecord)
            .toList();
    }

    @Override
    public InventorySnapshot inventory(String storeId, String itemId, LocalDate today) {
        InventoryProvenanceResolver.CachedStock cached = inventoryRepository
            .findFirstByStoreIdAndItemIdOrderByQueriedAtDesc(storeId, itemId)
            .map(c -> new InventoryProvenanceResolver.CachedStock(c.getStockQty(), c.getPendingQty(), c.isLive(), c.getQueriedAt()))
            .orElse(null);
        SalesRecord todayRecord = salesRepository.findByStoreIdAndItemIdAndSalesDate(storeId, itemId, today)
            .map(JpaStoreDataGateway::toRecord)
            .orElse(null);
        Duration ttl = Duration.ofMinutes(properties.getInventoryCacheTtlMinutes());
        return provenanceResolver.resolve(itemId, cached, todayRecord, today, Instant.now(), ttl);
    }

    @Override
    public Optional<Promotion> activePromotion(String storeId, String itemId, LocalDate date) {
        return promotionRepository.findActive(storeId, itemId, date).stream()
            .findFirst()
            .map(p -> new Promotion(p.getPromoType(), p.getStartDate(), p.getEndDate()));
    }

    @Override
    public DisuseStats categoryDisuse(String storeId, Collection<String> categoryCodes, LocalDate from, LocalDate to) {
        if (categoryCodes.isEmpty()) {
            return DisuseStats.empty();
        }
        List<Object[]> rows = salesRepository.disuseTotals(storeId, categoryCodes, from, to);
        if (rows.isEmpty() || rows.get(0) == null) {
            return DisuseStats.empty();
        }
        Object[] row = rows.get(0);
        int received = ((Number) row[0]).intValue();
        int disused = ((Number) row[1]).intValue();
        int days = ((Number) row[2]).intValue();
        return new DisuseStats(received, disused, days, 0, false);
    }

    @Override
    public List<DailyOrderCount> orderedItemCounts(String storeId, Collection<String> categoryCodes,
                                                   LocalDate from, LocalDate to) {
        if (categoryCodes.isEmpty()) {
            return List.of();
        }
        return salesRepository.orderedItemCounts(storeId, categoryCodes, from, to).stream()
            .map(row -> new DailyOrderCount((LocalDate) row[0], ((Number) row[1]).longValue()))
            .toList();
    }

    private ProductInfo toProductInfo(ProductMaster p) {
        String reason = null;
        if (p.isManualExclude()) {
            reason = "manually excluded";
        } else if (p.getStatus() == ProductMaster.ProductStatus.DISCONTINUED) {
            reason = "discontinued";
        } else if (p.getStatus() == ProductMaster.ProductStatus.ON_HOLD) {
            reason = "on hold";
        }
        return new ProductInfo(p.getItemId(), p.getItemName(), p.getCategoryCode(), p.getShelfLifeDays(),
                               p.getOrderUnit(), p.getMarginRate(), reason != null, reason);
    }

    static SalesRecord toRecord(DailySales s) {
        return new SalesRecord(s.getSalesDate(), s.getItemId(), s.getSaleQty(), s.getOrderQty(),
                               s.getReceiveQty(), s.getDisuseQty(), s.getStockQty());
    }
}
