package com.storereplenishment.service;

import com.storereplenishment.config.EngineProperties;
import com.storereplenishment.domain.PendingMode;
import com.storereplenishment.domain.ParameterSet;
import com.storereplenishment.domain.RunContext;
import com.storereplenishment.evaluation.ParameterStore;
import com.storereplenishment.exception.RunInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Freezes configuration and the stored calibration parameters into the
 * {@link RunContext} one run works with.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunContextFactory {

    private final EngineProperties properties;
    private final ParameterStore parameterStore;

    @Value("${model.api.enabled:true}")
    private boolean modelEnabled;

    public RunContext create(String storeId, LocalDate targetDate, boolean dryRun, PendingMode pendingOverride) {
        if (targetDate == null) {
            throw new RunInputException("Target date is required");
        }
        String store = storeId != null && !storeId.isBlank() ? storeId : properties.getStoreId();
        PendingMode mode = pendingOverride != null ? pendingOverride : properties.getPending().getMode();
        ParameterSet parameters = parameterStore.current();

        EngineProperties.Blend blend = properties.getBlend();
        EngineProperties.DailyCap cap = properties.getDailyCap();
        EngineProperties.Disuse disuse = properties.getDisuse();
        EngineProperties.Pending pending = properties.getPending();

        RunContext context = new RunContext(
            UUID.randomUUID(),
            store,
            targetDate,
            dryRun,
            mode,
            parameters,
            new RunContext.BlendSettings(modelEnabled, blend.getMinSamples(), blend.getFullWeightDays(),
                blend.getPartialModelWeight(), blend.getFullModelWeight()),
            new RunContext.OrderSettings(properties.getOrder().getMaxMultiplier(),
                pending.getHistoryDays(), pending.getSimplifiedLookbackDays()),
            new RunContext.CapSettings(cap.getWasteBuffer(), cap.getLookbackDays(), cap.getMinSameWeekdaySamples(),
                cap.getExploreRatio(), cap.getFallbackDailyAvg(), cap.getProvenMinDataDays(),
                cap.getExploreFailZeroDays()),
            new RunContext.DisuseSettings(disuse.getLookbackDays(), disuse.getMinBatchCount(),
                disuse.getMinCalendarDays(), disuse.getItemWeight(), disuse.getAbsoluteFloor())
        );
        log.info("Run context created | runId={} | store={} | target={} | dryRun={} | pending={} | model={}",
            context.runId(), store, targetDate, dryRun, mode, modelEnabled);
        log.debug("Run parameters | runId={} | {}", context.runId(), parameters);
        return context;
    }
}
