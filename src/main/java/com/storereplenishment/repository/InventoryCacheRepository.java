package com.storereplenishment.repository;

import com.storereplenishment.entity.InventoryCache;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface InventoryCacheRepository extends JpaRepository<InventoryCache, UUID> {

    Optional<InventoryCache> findFirstByStoreIdAndItemIdOrderByQueriedAtDesc(String storeId, String itemId);
}
