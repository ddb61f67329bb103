package com.storereplenishment.repository;

import com.storereplenishment.entity.CalibrationParameter;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CalibrationParameterRepository extends JpaRepository<CalibrationParameter, String> {
}
