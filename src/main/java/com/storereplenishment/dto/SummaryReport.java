package com.storereplenishment.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.OutcomeClass;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SummaryReport {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate from;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate to;
    Map<String, GroupTotals> byCategoryGroup;
    Map<Decision, Long> byDecision;
    Map<OutcomeClass, Long> byOutcome;
    long failedItems;
    long staleInventoryItems;
    long totalOrderQty;
    /** Share of verified outcomes judged correct; absent when nothing was verified. */
    Double accuracyRate;

    @Value
    @Builder
    public static class GroupTotals {
        long items;
        long orderQty;
    }
}
