package com.storereplenishment.collector;

import com.storereplenishment.domain.InventorySnapshot;
import com.storereplenishment.domain.InventorySource;
import com.storereplenishment.domain.SalesRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Chooses which stock figure to trust: a fresh cache entry, else a figure collected
 * today, else the stale cache entry flagged as stale.
 */
@Slf4j
@Component
public class InventoryProvenanceResolver {

    public InventorySnapshot resolve(String itemId, CachedStock cached, SalesRecord todayRecord,
                                     LocalDate today, Instant now, Duration ttl) {
        if (cached != null && !isStale(cached, now, ttl)) {
            InventorySource source = cached.live() ? InventorySource.LIVE : InventorySource.CACHE;
            return new InventorySnapshot(cached.stockQty(), cached.pendingQty(), source, false, cached.queriedAt());
        }

        boolean sameDay = todayRecord != null && today.equals(todayRecord.date());
        if (sameDay) {
            int pending = cached != null ? cached.pendingQty() : 0;
            if (cached != null) {
                log.info("Stale inventory cache replaced by same-day record | item={} | cached={} | today={}",
                         itemId, cached.stockQty(), todayRecord.stockQty());
            }
            return new InventorySnapshot(todayRecord.stockQty(), pending, InventorySource.FALLBACK, false, null);
        }

        if (cached != null) {
            log.warn("Using stale inventory cache | item={} | queriedAt={} | ttl={}", itemId, cached.queriedAt(), ttl);
            return new InventorySnapshot(cached.stockQty(), cached.pendingQty(), InventorySource.CACHE, true, cached.queriedAt());
        }

        log.warn("No inventory figure available | item={}", itemId);
        return InventorySnapshot.missing();
    }

    boolean isStale(CachedStock cached, Instant now, Duration ttl) {
        return cached.queriedAt() == null || Duration.between(cached.queriedAt(), now).compareTo(ttl) > 0;
    }

    public record CachedStock(int stockQty, int pendingQty, boolean live, Instant queriedAt) {}
}
