package com.storereplenishment.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.PendingMode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunSummary {
    UUID runId;
    String storeId;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate targetDate;
    boolean dryRun;
    PendingMode pendingMode;
    boolean aborted;

    int totalItems;
    int predicted;
    /** Items skipped due to data error; distinct from SKIP decisions. */
    int failed;
    List<FailedItem> failedItems;

    Map<Decision, Long> decisions;
    int orderedItems;
    int totalOrderQty;
    int capDropped;
    int staleInventory;
    int recalculated;
    int submittedLines;
    int acceptedLines;
    String submissionError;

    boolean modelAvailable;
    int blendedItems;
    PendingComparison pendingComparison;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;

    @Value
    @Builder
    public static class FailedItem {
        String itemId;
        String reason;
    }

    @Value
    @Builder
    public static class PendingComparison {
        int total;
        int matches;
        int differences;
        int aggregateHigher;
        int simplifiedHigher;
        int maxDifference;
        int crossDateCases;
        double matchRate;
    }
}
