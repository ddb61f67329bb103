package com.storereplenishment.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class TrainingSetResponse {
    String itemId;
    String categoryGroup;
    List<String> featureNames;
    List<Row> rows;

    @Value
    @Builder
    public static class Row {
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate date;
        double[] features;
        int target;
    }
}
