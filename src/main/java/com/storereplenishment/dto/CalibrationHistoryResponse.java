package com.storereplenishment.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CalibrationHistoryResponse {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate calibrationDate;
    String paramName;
    double oldValue;
    double newValue;
    String reason;
    Double accuracyBefore;
    int sampleSize;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
}
