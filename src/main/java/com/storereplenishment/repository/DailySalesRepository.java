package com.storereplenishment.repository;

import com.storereplenishment.entity.DailySales;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DailySalesRepository extends JpaRepository<DailySales, UUID> {

    List<DailySales> findByStoreIdAndItemIdAndSalesDateBetweenOrderBySalesDateAsc(
        String storeId, String itemId, LocalDate from, LocalDate to);

    Optional<DailySales> findByStoreIdAndItemIdAndSalesDate(String storeId, String itemId, LocalDate salesDate);

    @Query("""
        SELECT COALESCE(SUM(s.receiveQty), 0), COALESCE(SUM(s.disuseQty), 0), COUNT(DISTINCT s.salesDate)
        FROM DailySales s
        WHERE s.storeId = :storeId
          AND s.categoryCode IN :codes
          AND s.salesDate >= :from AND s.salesDate < :to
    """)
    List<Object[]> disuseTotals(@Param("storeId") String storeId,
                                @Param("codes") Collection<String> codes,
                                @Param("from") LocalDate from,
                                @Param("to") LocalDate to);

    @Query("""
        SELECT s.salesDate, COUNT(DISTINCT s.itemId)
        FROM DailySales s
        WHERE s.storeId = :storeId
          AND s.categoryCode IN :codes
          AND s.orderQty > 0
          AND s.salesDate >= :from AND s.salesDate < :to
        GROUP BY s.salesDate
        ORDER BY s.salesDate ASC
    """)
    List<Object[]> orderedItemCounts(@Param("storeId") String storeId,
                                     @Param("codes") Collection<String> codes,
                                     @Param("from") LocalDate from,
                                     @Param("to") LocalDate to);
}
