package com.storereplenishment.controller;

import com.storereplenishment.dto.SummaryReport;
import com.storereplenishment.service.ReportQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportQueryService reportQueryService;

    @GetMapping("/daily")
    public ResponseEntity<SummaryReport> daily(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(reportQueryService.dailySummary(date));
    }

    @GetMapping("/weekly")
    public ResponseEntity<SummaryReport> weekly(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekEnd) {
        return ResponseEntity.ok(reportQueryService.weeklySummary(weekEnd));
    }
}
