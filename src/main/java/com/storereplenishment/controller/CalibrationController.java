package com.storereplenishment.controller;

import com.storereplenishment.dto.CalibrationHistoryResponse;
import com.storereplenishment.dto.ParameterResponse;
import com.storereplenishment.evaluation.DailyCalibrationReport;
import com.storereplenishment.evaluation.OutcomeCalibrator;
import com.storereplenishment.evaluation.ParameterChange;
import com.storereplenishment.service.ReportQueryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/calibration")
@RequiredArgsConstructor
public class CalibrationController {

    private final OutcomeCalibrator outcomeCalibrator;
    private final ReportQueryService reportQueryService;

    @PostMapping("/daily")
    public ResponseEntity<DailyCalibrationReport> runDaily(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate today = date != null ? date : LocalDate.now();
        log.info("POST /calibration/daily | date={}", today);
        return ResponseEntity.ok(outcomeCalibrator.runDaily(today));
    }

    @PostMapping("/clamp")
    public ResponseEntity<List<ParameterChange>> clamp() {
        log.info("POST /calibration/clamp");
        return ResponseEntity.ok(outcomeCalibrator.clampOutOfRange(LocalDate.now()));
    }

    @GetMapping("/parameters")
    public ResponseEntity<List<ParameterResponse>> parameters() {
        return ResponseEntity.ok(reportQueryService.currentParameters());
    }

    @GetMapping("/history")
    public ResponseEntity<List<CalibrationHistoryResponse>> history(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(reportQueryService.calibrationHistory(limit));
    }
}
