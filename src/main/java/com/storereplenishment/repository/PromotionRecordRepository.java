package com.storereplenishment.repository;

import com.storereplenishment.entity.PromotionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface PromotionRecordRepository extends JpaRepository<PromotionRecord, UUID> {

    @Query("""
        SELECT p FROM PromotionRecord p
        WHERE p.storeId = :storeId
          AND p.itemId = :itemId
          AND (p.startDate IS NULL OR p.startDate <= :date)
          AND (p.endDate IS NULL OR p.endDate >= :date)
        ORDER BY p.startDate DESC
    """)
    List<PromotionRecord> findActive(@Param("storeId") String storeId,
                                     @Param("itemId") String itemId,
                                     @Param("date") LocalDate date);
}
