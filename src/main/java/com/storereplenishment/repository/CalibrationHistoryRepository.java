package com.storereplenishment.repository;

import com.storereplenishment.entity.CalibrationHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CalibrationHistoryRepository extends JpaRepository<CalibrationHistory, UUID> {

    List<CalibrationHistory> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<CalibrationHistory> findByParamNameOrderByCreatedAtDesc(String paramName, Pageable pageable);
}
