package com.storereplenishment.evaluation;

import com.storereplenishment.domain.ParameterKey;
import com.storereplenishment.domain.ParameterSet;
import com.storereplenishment.entity.CalibrationHistory;
import com.storereplenishment.entity.CalibrationParameter;
import com.storereplenishment.repository.CalibrationHistoryRepository;
import com.storereplenishment.repository.CalibrationParameterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent home of the calibration parameters. Runs read a {@link ParameterSet}
 * snapshot from here; only the calibrator and the startup range check write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParameterStore {

    static final String CLAMP_REASON = "clamped to valid range";

    private final CalibrationParameterRepository parameterRepository;
    private final CalibrationHistoryRepository historyRepository;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        seedMissing();
        clampOutOfRange(LocalDate.now());
    }

    @Transactional
    public int seedMissing() {
        int seeded = 0;
        for (ParameterKey key : ParameterKey.values()) {
            if (parameterRepository.existsById(key.paramName())) {
                continue;
            }
            parameterRepository.save(CalibrationParameter.builder()
                .paramName(key.paramName())
                .currentValue(key.defaultValue())
                .defaultValue(key.defaultValue())
                .minValue(key.minValue())
                .maxValue(key.maxValue())
                .lastAdjustedReason("seeded default")
                .build());
            seeded++;
        }
        if (seeded > 0) {
            log.info("Calibration parameters seeded | count={}", seeded);
        }
        return seeded;
    }

    @Transactional(readOnly = true)
    public ParameterSet current() {
        Map<ParameterKey, Double> values = new EnumMap<>(ParameterKey.class);
        for (CalibrationParameter row : parameterRepository.findAll()) {
            keyOf(row.getParamName()).ifPresent(key -> values.put(key, row.getCurrentValue()));
        }
        return ParameterSet.of(values);
    }

    @Transactional(readOnly = true)
    public List<CalibrationParameter> all() {
        return parameterRepository.findAll();
    }

    /**
     * Brings every stored value back inside the range currently configured for its key,
     * also refreshing the stored bounds. Each clamp is written to history.
     */
    @Transactional
    public List<ParameterChange> clampOutOfRange(LocalDate date) {
        List<ParameterChange> clamped = new ArrayList<>();
        for (CalibrationParameter row : parameterRepository.findAll()) {
            Optional<ParameterKey> maybeKey = keyOf(row.getParamName());
            if (maybeKey.isEmpty()) {
                continue;
            }
            ParameterKey key = maybeKey.get();
            row.setMinValue(key.minValue());
            row.setMaxValue(key.maxValue());
            row.setDefaultValue(key.defaultValue());
            double value = row.getCurrentValue();
            if (!key.inRange(value)) {
                double fixed = key.clamp(value);
                log.warn("Calibration parameter out of range | param={} | value={} | clamped={} | range=[{}, {}]",
                    key.paramName(), value, fixed, key.minValue(), key.maxValue());
                clamped.add(new ParameterChange(key, value, fixed, CLAMP_REASON, null, 0));
            }
            parameterRepository.save(row);
        }
        apply(clamped, date);
        return clamped;
    }

    @Transactional
    public void apply(List<ParameterChange> changes, LocalDate date) {
        for (ParameterChange change : changes) {
            CalibrationParameter row = parameterRepository.findById(change.key().paramName())
                .orElseGet(() -> CalibrationParameter.builder()
                    .paramName(change.key().paramName())
                    .defaultValue(change.key().defaultValue())
                    .minValue(change.key().minValue())
                    .maxValue(change.key().maxValue())
                    .build());
            row.setCurrentValue(change.newValue());
            row.setLastAdjustedReason(change.reason());
            parameterRepository.save(row);

            historyRepository.save(CalibrationHistory.builder()
                .calibrationDate(date)
                .paramName(change.key().paramName())
                .oldValue(change.oldValue())
                .newValue(change.newValue())
                .reason(change.reason())
                .accuracyBefore(change.accuracyBefore())
                .sampleSize(change.sampleSize())
                .build());

            log.info("Calibration parameter updated | param={} | {} -> {} | reason={}",
                change.key().paramName(), change.oldValue(), change.newValue(), change.reason());
        }
    }

    private static Optional<ParameterKey> keyOf(String paramName) {
        for (ParameterKey key : ParameterKey.values()) {
            if (key.paramName().equals(paramName)) {
                return Optional.of(key);
            }
        }
        log.warn("Unknown calibration parameter ignored | param={}", paramName);
        return Optional.empty();
    }
}
