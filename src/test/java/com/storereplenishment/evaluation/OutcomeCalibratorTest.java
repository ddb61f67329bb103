package com.storereplenishment.evaluation;

import com.storereplenishment.TestFixtures;
import com.storereplenishment.collector.StoreDataGateway;
import com.storereplenishment.config.EngineProperties;
import com.storereplenishment.domain.CategoryGroup;
import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.OutcomeClass;
import com.storereplenishment.domain.ParameterKey;
import com.storereplenishment.domain.ParameterSet;
import com.storereplenishment.entity.EvalOutcome;
import com.storereplenishment.entity.PredictionLog;
import com.storereplenishment.entity.PredictionStatus;
import com.storereplenishment.repository.EvalOutcomeRepository;
import com.storereplenishment.repository.PredictionLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutcomeCalibratorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
    private static final LocalDate EVAL_DATE = TODAY.minusDays(1);

    @Mock
    PredictionLogRepository predictionLogRepository;

    @Mock
    EvalOutcomeRepository evalOutcomeRepository;

    @Mock
    StoreDataGateway storeDataGateway;

    @Mock
    ParameterStore parameterStore;

    @Mock
    CalibrationRules calibrationRules;

    EngineProperties properties;

    OutcomeCalibrator calibrator;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.setStoreId(TestFixtures.STORE);
        calibrator = new OutcomeCalibrator(predictionLogRepository, evalOutcomeRepository, storeDataGateway,
                                           parameterStore, calibrationRules, properties);
    }

    private static PredictionLog predicted(String itemId, Decision decision) {
        return predicted(TestFixtures.STORE, itemId, decision);
    }

    private static PredictionLog predicted(String storeId, String itemId, Decision decision) {
        return PredictionLog.builder()
            .storeId(storeId)
            .itemId(itemId)
            .targetDate(EVAL_DATE)
            .status(PredictionStatus.PREDICTED)
            .categoryGroup(CategoryGroup.FOOD.name())
            .decision(decision)
            .finalOrderQty(3)
            .dailyAverage(2.0)
            .popularityScore(0.5)
            .exposureDays(1.5)
            .build();
    }

    private static EvalOutcome outcome(OutcomeClass outcomeClass) {
        return EvalOutcome.builder()
            .evalDate(EVAL_DATE)
            .itemId("I-1")
            .decision(Decision.NORMAL_ORDER)
            .categoryGroup(CategoryGroup.SNACK.name())
            .outcomeClass(outcomeClass)
            .build();
    }

    @Test
    void verify_judgesLatestDecisionPerItem() {
        when(predictionLogRepository.findByTargetDateAndStatusOrderByCreatedAtAsc(EVAL_DATE, PredictionStatus.PREDICTED))
            .thenReturn(List.of(
                predicted("I-1", Decision.PASS),
                predicted("I-1", Decision.NORMAL_ORDER),
                predicted("I-2", Decision.NORMAL_ORDER),
                predicted("I-3", Decision.PASS)));
        lenient().when(evalOutcomeRepository.existsByEvalDateAndStoreIdAndItemId(EVAL_DATE, TestFixtures.STORE, "I-2")).thenReturn(true);
        lenient().when(storeDataGateway.salesHistory(TestFixtures.STORE, "I-1", EVAL_DATE, EVAL_DATE))
            .thenReturn(List.of(TestFixtures.sale(EVAL_DATE, 0, 0)));

        VerificationResult result = calibrator.verify(EVAL_DATE);

        assertThat(result.verified()).isEqualTo(1);
        assertThat(result.alreadyVerified()).isEqualTo(1);
        assertThat(result.missingActuals()).isEqualTo(1);
        assertThat(result.byOutcome()).containsEntry(OutcomeClass.UNDER_ORDER, 1);

        ArgumentCaptor<EvalOutcome> saved = ArgumentCaptor.forClass(EvalOutcome.class);
        verify(evalOutcomeRepository).save(saved.capture());
        assertThat(saved.getValue().getItemId()).isEqualTo("I-1");
        assertThat(saved.getValue().getStoreId()).isEqualTo(TestFixtures.STORE);
        assertThat(saved.getValue().getDecision()).isEqualTo(Decision.NORMAL_ORDER);
        assertThat(saved.getValue().isWasStockout()).isTrue();
        assertThat(saved.getValue().getOutcomeClass()).isEqualTo(OutcomeClass.UNDER_ORDER);
    }

    @Test
    void verify_readsSalesOfTheStoreThatMadeTheDecision() {
        when(predictionLogRepository.findByTargetDateAndStatusOrderByCreatedAtAsc(EVAL_DATE, PredictionStatus.PREDICTED))
            .thenReturn(List.of(predicted("S2", "I-1", Decision.NORMAL_ORDER)));
        when(storeDataGateway.salesHistory("S2", "I-1", EVAL_DATE, EVAL_DATE))
            .thenReturn(List.of(TestFixtures.sale(EVAL_DATE, 5, 2)));

        VerificationResult result = calibrator.verify(EVAL_DATE);

        assertThat(result.verified()).isEqualTo(1);
        assertThat(result.missingActuals()).isZero();
        verify(storeDataGateway, never()).salesHistory(eq(TestFixtures.STORE), any(), any(), any());

        ArgumentCaptor<EvalOutcome> saved = ArgumentCaptor.forClass(EvalOutcome.class);
        verify(evalOutcomeRepository).save(saved.capture());
        assertThat(saved.getValue().getStoreId()).isEqualTo("S2");
        assertThat(saved.getValue().getActualSoldQty()).isEqualTo(5);
    }

    @Test
    void verify_sameItemInTwoStoresIsJudgedForEach() {
        when(predictionLogRepository.findByTargetDateAndStatusOrderByCreatedAtAsc(EVAL_DATE, PredictionStatus.PREDICTED))
            .thenReturn(List.of(
                predicted("S1", "I-1", Decision.NORMAL_ORDER),
                predicted("S2", "I-1", Decision.PASS)));
        when(storeDataGateway.salesHistory("S1", "I-1", EVAL_DATE, EVAL_DATE))
            .thenReturn(List.of(TestFixtures.sale(EVAL_DATE, 3, 1)));
        when(storeDataGateway.salesHistory("S2", "I-1", EVAL_DATE, EVAL_DATE))
            .thenReturn(List.of(TestFixtures.sale(EVAL_DATE, 0, 4)));

        VerificationResult result = calibrator.verify(EVAL_DATE);

        assertThat(result.verified()).isEqualTo(2);
        ArgumentCaptor<EvalOutcome> saved = ArgumentCaptor.forClass(EvalOutcome.class);
        verify(evalOutcomeRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(EvalOutcome::getStoreId).containsExactly("S1", "S2");
    }

    @Test
    void calibrate_skipsWithTooFewSamples() {
        when(evalOutcomeRepository.findByEvalDateBetweenOrderByEvalDateAsc(TODAY.minusDays(30), TODAY))
            .thenReturn(List.of(outcome(OutcomeClass.CORRECT)));

        CalibrationResult result = calibrator.calibrate(TODAY);

        assertThat(result.skipped()).isTrue();
        assertThat(result.skipReason()).isEqualTo("insufficient samples");
        verify(calibrationRules, never()).propose(any(), any(), anyInt(), anyInt());
        verify(parameterStore, never()).apply(anyList(), any());
    }

    @Test
    void calibrate_appliesProposedChanges() {
        List<EvalOutcome> window = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            window.add(outcome(i % 4 == 0 ? OutcomeClass.OVER_ORDER : OutcomeClass.CORRECT));
        }
        ParameterChange change = new ParameterChange(ParameterKey.EXPOSURE_SUFFICIENT, 3.0, 3.5, "test", 0.75, 60);
        when(evalOutcomeRepository.findByEvalDateBetweenOrderByEvalDateAsc(TODAY.minusDays(30), TODAY)).thenReturn(window);
        when(parameterStore.current()).thenReturn(ParameterSet.defaults());
        when(calibrationRules.propose(any(CalibrationInputs.class), any(ParameterSet.class), eq(50), eq(3)))
            .thenReturn(List.of(change));

        CalibrationResult result = calibrator.calibrate(TODAY);

        assertThat(result.skipped()).isFalse();
        assertThat(result.sampleSize()).isEqualTo(60);
        assertThat(result.accuracy()).isEqualTo(0.75);
        assertThat(result.changes()).containsExactly(change);
        verify(parameterStore).apply(List.of(change), TODAY);
    }

    @Test
    void runDaily_verifiesYesterday() {
        when(parameterStore.clampOutOfRange(TODAY)).thenReturn(List.of());

        DailyCalibrationReport report = calibrator.runDaily(TODAY);

        assertThat(report.verification().evalDate()).isEqualTo(EVAL_DATE);
        assertThat(report.calibration().skipped()).isTrue();
    }
}
