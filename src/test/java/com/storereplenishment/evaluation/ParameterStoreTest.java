package com.storereplenishment.evaluation;

import com.storereplenishment.domain.ParameterKey;
import com.storereplenishment.domain.ParameterSet;
import com.storereplenishment.entity.CalibrationHistory;
import com.storereplenishment.entity.CalibrationParameter;
import com.storereplenishment.repository.CalibrationHistoryRepository;
import com.storereplenishment.repository.CalibrationParameterRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ParameterStoreTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Mock
    CalibrationParameterRepository parameterRepository;

    @Mock
    CalibrationHistoryRepository historyRepository;

    @InjectMocks
    ParameterStore parameterStore;

    private static CalibrationParameter row(ParameterKey key, double value) {
        return CalibrationParameter.builder()
            .paramName(key.paramName())
            .currentValue(value)
            .defaultValue(key.defaultValue())
            .minValue(key.minValue())
            .maxValue(key.maxValue())
            .build();
    }

    @Test
    void seedMissing_insertsEveryAbsentKeyWithDefault() {
        when(parameterRepository.existsById(anyString())).thenReturn(false);

        int seeded = parameterStore.seedMissing();

        assertThat(seeded).isEqualTo(ParameterKey.values().length);
        verify(parameterRepository, times(ParameterKey.values().length)).save(any(CalibrationParameter.class));
    }

    @Test
    void current_readsStoredValuesAndIgnoresUnknownNames() {
        CalibrationParameter unknown = CalibrationParameter.builder().paramName("retired_param").currentValue(9).build();
        when(parameterRepository.findAll()).thenReturn(List.of(row(ParameterKey.EXPOSURE_URGENT, 1.4), unknown));

        ParameterSet current = parameterStore.current();

        assertThat(current.get(ParameterKey.EXPOSURE_URGENT)).isEqualTo(1.4);
        assertThat(current.get(ParameterKey.EXPOSURE_NORMAL)).isEqualTo(ParameterKey.EXPOSURE_NORMAL.defaultValue());
    }

    @Test
    void clampOutOfRange_pullsValueBackAndRecordsHistory() {
        CalibrationParameter drifted = row(ParameterKey.EXPOSURE_SUFFICIENT, 9.0);
        CalibrationParameter fine = row(ParameterKey.EXPOSURE_URGENT, 1.0);
        when(parameterRepository.findAll()).thenReturn(List.of(drifted, fine));
        when(parameterRepository.findById(ParameterKey.EXPOSURE_SUFFICIENT.paramName())).thenReturn(Optional.of(drifted));

        List<ParameterChange> clamped = parameterStore.clampOutOfRange(TODAY);

        assertThat(clamped).singleElement().satisfies(c -> {
            assertThat(c.key()).isEqualTo(ParameterKey.EXPOSURE_SUFFICIENT);
            assertThat(c.oldValue()).isEqualTo(9.0);
            assertThat(c.newValue()).isEqualTo(5.0);
            assertThat(c.reason()).isEqualTo(ParameterStore.CLAMP_REASON);
        });
        assertThat(drifted.getCurrentValue()).isEqualTo(5.0);
        ArgumentCaptor<CalibrationHistory> history = ArgumentCaptor.forClass(CalibrationHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getCalibrationDate()).isEqualTo(TODAY);
        assertThat(history.getValue().getOldValue()).isEqualTo(9.0);
    }

    @Test
    void clampOutOfRange_inRangeValuesLeaveNoHistory() {
        when(parameterRepository.findAll()).thenReturn(List.of(row(ParameterKey.EXPOSURE_URGENT, 1.0)));

        assertThat(parameterStore.clampOutOfRange(TODAY)).isEmpty();
        verify(historyRepository, never()).save(any());
    }

    @Test
    void apply_updatesValueAndReason() {
        CalibrationParameter stored = row(ParameterKey.DISUSE_MULTIPLIER, 1.2);
        when(parameterRepository.findById(ParameterKey.DISUSE_MULTIPLIER.paramName())).thenReturn(Optional.of(stored));

        parameterStore.apply(List.of(new ParameterChange(ParameterKey.DISUSE_MULTIPLIER, 1.2, 1.27,
            "perishable over-order share 0.40", 0.7, 60)), TODAY);

        assertThat(stored.getCurrentValue()).isEqualTo(1.27);
        assertThat(stored.getLastAdjustedReason()).startsWith("perishable");
        verify(historyRepository).save(any(CalibrationHistory.class));
    }
}
