package com.storereplenishment.repository;

import com.storereplenishment.entity.PredictionLog;
import com.storereplenishment.entity.PredictionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface PredictionLogRepository extends JpaRepository<PredictionLog, UUID> {

    List<PredictionLog> findByRunIdOrderByItemIdAsc(UUID runId);

    List<PredictionLog> findByTargetDateAndStatusOrderByCreatedAtAsc(LocalDate targetDate, PredictionStatus status);

    @Query("""
        SELECT p.categoryGroup, COUNT(p), SUM(p.finalOrderQty)
        FROM PredictionLog p
        WHERE p.status = com.storereplenishment.entity.PredictionStatus.PREDICTED
          AND p.targetDate BETWEEN :from AND :to
        GROUP BY p.categoryGroup
    """)
    List<Object[]> countByCategoryGroup(@Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("""
        SELECT p.decision, COUNT(p)
        FROM PredictionLog p
        WHERE p.status = com.storereplenishment.entity.PredictionStatus.PREDICTED
          AND p.targetDate BETWEEN :from AND :to
        GROUP BY p.decision
    """)
    List<Object[]> countByDecision(@Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("""
        SELECT COUNT(p) FROM PredictionLog p
        WHERE p.status = com.storereplenishment.entity.PredictionStatus.FAILED
          AND p.targetDate BETWEEN :from AND :to
    """)
    long countFailed(@Param("from") LocalDate from, @Param("to") LocalDate to);

    @Query("""
        SELECT COUNT(p) FROM PredictionLog p
        WHERE p.stockStale = true
          AND p.targetDate BETWEEN :from AND :to
    """)
    long countStale(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
