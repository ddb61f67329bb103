package com.storereplenishment.service;

import com.storereplenishment.dto.RunJobResponse;
import com.storereplenishment.dto.RunJobStatus;
import com.storereplenishment.dto.RunRequest;
import com.storereplenishment.dto.RunSummary;
import com.storereplenishment.exception.RunNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Queues replenishment runs on a single worker thread, so runs never overlap, and
 * keeps their status for polling. Abort is cooperative: the run stops at the next
 * item boundary.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunJobService {

    private final ReplenishmentRunService runService;

    @Value("${jobs.max-retained:200}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "replenishment-run");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            jobs.values().forEach(JobState::requestAbort);
            executor.shutdown();
        }
    }

    public UUID submit(RunRequest request, String requestId) {
        UUID jobId = UUID.randomUUID();
        JobState state = JobState.queued(jobId, request, requestId);
        jobs.put(jobId, state);
        cleanupIfNeeded();

        CompletableFuture.runAsync(() -> execute(state), executor);
        log.info("Run queued | jobId={} | store={} | target={} | dryRun={} | requestId={}",
            jobId, request.getStoreId(), request.getTargetDate(), request.isDryRun(), requestId);
        return jobId;
    }

    public RunJobResponse getJob(UUID jobId) {
        return find(jobId).toResponse();
    }

    public RunJobResponse abort(UUID jobId) {
        JobState state = find(jobId);
        if (!state.status.isFinished()) {
            state.requestAbort();
            log.info("Run abort requested | jobId={} | status={}", jobId, state.status);
        }
        return state.toResponse();
    }

    private JobState find(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new RunNotFoundException(jobId);
        }
        return state;
    }

    private void execute(JobState state) {
        if (state.abortRequested) {
            state.markAborted(null, "Aborted before start");
            return;
        }
        if (state.requestId != null) {
            MDC.put("requestId", state.requestId);
        }
        state.markRunning();
        try {
            RunSummary summary = runService.execute(state.request, () -> state.abortRequested);
            if (summary.isAborted()) {
                state.markAborted(summary, "Run aborted between items");
            } else {
                state.markCompleted(summary);
            }
        } catch (Exception ex) {
            log.error("Run failed | jobId={} | error={}", state.jobId, ex.getMessage(), ex);
            state.markFailed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        } finally {
            MDC.remove("requestId");
        }
    }

    private void cleanupIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status.isFinished())
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final RunRequest request;
        private final String requestId;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile RunJobStatus status;
        private volatile boolean abortRequested;
        private volatile String message;
        private volatile RunSummary summary;

        private JobState(UUID jobId, RunRequest request, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.request = request;
            this.requestId = requestId;
            this.createdAt = createdAt;
            this.status = RunJobStatus.QUEUED;
            this.message = "Queued";
        }

        private static JobState queued(UUID id, RunRequest request, String requestId) {
            return new JobState(id, request, requestId, Instant.now());
        }

        private void requestAbort() {
            this.abortRequested = true;
        }

        private synchronized void markRunning() {
            this.startedAt = Instant.now();
            this.status = RunJobStatus.RUNNING;
            this.message = "Run started";
        }

        private synchronized void markCompleted(RunSummary summary) {
            this.completedAt = Instant.now();
            this.status = RunJobStatus.COMPLETED;
            this.summary = summary;
            this.message = "Run completed";
        }

        private synchronized void markAborted(RunSummary summary, String message) {
            this.completedAt = Instant.now();
            this.status = RunJobStatus.ABORTED;
            this.summary = summary;
            this.message = message;
        }

        private synchronized void markFailed(String message) {
            this.completedAt = Instant.now();
            this.status = RunJobStatus.FAILED;
            this.message = message;
        }

        private RunJobResponse toResponse() {
            return RunJobResponse.builder()
                .jobId(jobId)
                .storeId(request.getStoreId())
                .targetDate(request.getTargetDate())
                .status(status)
                .abortRequested(abortRequested)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .message(message)
                .summary(summary)
                .requestId(requestId)
                .build();
        }
    }
}
