package com.storereplenishment.controller;

import com.storereplenishment.config.RequestIdFilter;
import com.storereplenishment.dto.RunJobResponse;
import com.storereplenishment.dto.RunRequest;
import com.storereplenishment.service.RunJobService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
public class RunController {

    private final RunJobService runJobService;

    @PostMapping
    public ResponseEntity<RunJobResponse> startRun(
            @Valid @RequestBody RunRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /runs | store={} | target={} | dryRun={} | pending={} | requestId={}",
                 request.getStoreId(), request.getTargetDate(), request.isDryRun(),
                 request.getPendingMode(), requestId);
        UUID jobId = runJobService.submit(request, requestId);
        return ResponseEntity.accepted()
            .header(RequestIdFilter.HEADER, requestId)
            .header("Location", "/api/v1/runs/" + jobId)
            .body(runJobService.getJob(jobId));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<RunJobResponse> runStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(runJobService.getJob(jobId));
    }

    @PostMapping("/{jobId}/abort")
    public ResponseEntity<RunJobResponse> abortRun(@PathVariable UUID jobId) {
        log.info("POST /runs/{}/abort", jobId);
        return ResponseEntity.accepted().body(runJobService.abort(jobId));
    }
}
