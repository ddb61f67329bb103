package com.storereplenishment.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.storereplenishment.domain.PendingMode;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class RunRequest {

    @Pattern(regexp = "[A-Za-z0-9_-]{1,32}", message = "storeId must be 1-32 letters, digits, '_' or '-'")
    String storeId;

    /** Sales date being ordered for; defaults to tomorrow. */
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate targetDate;

    boolean dryRun;

    /** Overrides the configured pending algorithm for this run only. */
    PendingMode pendingMode;
}
