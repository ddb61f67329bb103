package com.storereplenishment.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ParameterResponse {
    String paramName;
    double currentValue;
    double defaultValue;
    double minValue;
    double maxValue;
    String lastAdjustedReason;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;
}
