package com.storereplenishment.repository;

import com.storereplenishment.entity.EvalOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface EvalOutcomeRepository extends JpaRepository<EvalOutcome, UUID> {

    boolean existsByEvalDateAndStoreIdAndItemId(LocalDate evalDate, String storeId, String itemId);

    List<EvalOutcome> findByEvalDateBetweenOrderByEvalDateAsc(LocalDate from, LocalDate to);

    @Query("""
        SELECT e.outcomeClass, COUNT(e)
        FROM EvalOutcome e
        WHERE e.evalDate BETWEEN :from AND :to
        GROUP BY e.outcomeClass
    """)
    List<Object[]> countByOutcomeClass(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
