package com.claude.patternlearning.service;

import com.claude.patternlearning.config.PatternLearningConfig;
import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.detector.DetectionResult;
import com.claude.patternlearning.detector.LearningDataset;
import com.claude.patternlearning.detector.PatternDetector;
import com.claude.patternlearning.entity.LearningRunRecord;
import com.claude.patternlearning.entity.LearningRunRecord.DetectorOutcome;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.exception.PatternCodecException;
import com.claude.patternlearning.exception.PatternStoreException;
import com.claude.patternlearning.pattern.WhoPatternPayload;
import com.claude.patternlearning.repository.LearningRunRecordRepository;
import com.claude.patternlearning.store.PatternStore;
import com.claude.patternlearning.store.StoreOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TenantLearningService")
class TenantLearningServiceTest {

    private static final String TENANT = "tenant-a";
    private static final String RUN = "20260301T030000-abcd1234";

    @Mock
    private PatternDetector whoDetector;

    @Mock
    private LearningDatasetLoader datasetLoader;

    @Mock
    private PatternStore patternStore;

    @Mock
    private LearningRunRecordRepository runRecordRepository;

    private final LearningDataset dataset = LearningDataset.builder()
            .tenantId(TENANT)
            .leads(Collections.emptyList())
            .touches(Collections.emptyList())
            .build();

    private TenantLearningService service;

    @BeforeEach
    void setUp() {
        PatternLearningProperties properties = new PatternLearningProperties();
        properties.getRetry().setDelayMs(1);
        when(whoDetector.getPatternType()).thenReturn(PatternType.WHO);
        when(runRecordRepository.save(any(LearningRunRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        service = new TenantLearningService(List.of(whoDetector), datasetLoader, patternStore, runRecordRepository,
                new PatternLearningConfig().learningRetryTemplate(properties),
                Clock.fixed(Instant.parse("2026-03-01T03:00:00Z"), ZoneOffset.UTC));
    }

    private static DetectionResult confident() {
        return DetectionResult.of(WhoPatternPayload.defaults(60, 200), 200, 0.66);
    }

    private LearningRunRecord lastSavedRecord() {
        ArgumentCaptor<LearningRunRecord> saved = ArgumentCaptor.forClass(LearningRunRecord.class);
        verify(runRecordRepository, atLeastOnce()).save(saved.capture());
        return saved.getValue();
    }

    @Test
    @DisplayName("retries a failing write and stores on a later attempt")
    void retriesStore() {
        DetectionResult result = confident();
        when(datasetLoader.load(TENANT)).thenReturn(dataset);
        when(whoDetector.detect(dataset)).thenReturn(result);
        when(patternStore.save(TENANT, result))
                .thenThrow(new PatternStoreException("write failed", new CannotAcquireLockException("deadlock")))
                .thenThrow(new CannotAcquireLockException("deadlock"))
                .thenReturn(StoreOutcome.PROMOTED);

        DetectorOutcome outcome = service.runDetector(TENANT, RUN, PatternType.WHO);

        assertThat(outcome).isEqualTo(DetectorOutcome.STORED);
        verify(patternStore, times(3)).save(TENANT, result);
        LearningRunRecord record = lastSavedRecord();
        assertThat(record.getStatus()).isEqualTo(LearningRunRecord.RunStatus.COMPLETED);
        assertThat(record.getSampleSize()).isEqualTo(200);
    }

    @Test
    @DisplayName("reports STORE_FAILED once retries are exhausted")
    void storeFailsAfterRetries() {
        DetectionResult result = confident();
        when(datasetLoader.load(TENANT)).thenReturn(dataset);
        when(whoDetector.detect(dataset)).thenReturn(result);
        when(patternStore.save(TENANT, result)).thenThrow(new PatternStoreException("database unavailable",
                new TransientDataAccessResourceException("connection refused")));

        DetectorOutcome outcome = service.runDetector(TENANT, RUN, PatternType.WHO);

        assertThat(outcome).isEqualTo(DetectorOutcome.STORE_FAILED);
        verify(patternStore, times(3)).save(TENANT, result);
        LearningRunRecord record = lastSavedRecord();
        assertThat(record.isFailed()).isTrue();
        assertThat(record.getOutcome()).isEqualTo(DetectorOutcome.STORE_FAILED);
        assertThat(record.getErrorMessage()).isEqualTo("database unavailable");
    }

    @Test
    @DisplayName("does not retry errors that are not transient")
    void nonRetryableStoreError() {
        DetectionResult result = confident();
        when(datasetLoader.load(TENANT)).thenReturn(dataset);
        when(whoDetector.detect(dataset)).thenReturn(result);
        when(patternStore.save(TENANT, result)).thenThrow(new PatternStoreException("duplicate version",
                new DataIntegrityViolationException("uk_pattern_history")));

        assertThat(service.runDetector(TENANT, RUN, PatternType.WHO)).isEqualTo(DetectorOutcome.STORE_FAILED);
        verify(patternStore, times(1)).save(TENANT, result);
    }

    @Test
    @DisplayName("does not retry a payload that cannot be encoded")
    void encodingErrorNotRetried() {
        DetectionResult result = confident();
        when(datasetLoader.load(TENANT)).thenReturn(dataset);
        when(whoDetector.detect(dataset)).thenReturn(result);
        when(patternStore.save(TENANT, result)).thenThrow(new PatternCodecException("Cannot encode WhoPatternPayload",
                new IllegalArgumentException("NaN weight")));

        assertThat(service.runDetector(TENANT, RUN, PatternType.WHO)).isEqualTo(DetectorOutcome.STORE_FAILED);
        verify(patternStore, times(1)).save(TENANT, result);
        assertThat(lastSavedRecord().getErrorMessage()).isEqualTo("Cannot encode WhoPatternPayload");
    }

    @Test
    @DisplayName("reports DETECTOR_FAILED without touching the store")
    void detectorFails() {
        when(datasetLoader.load(TENANT)).thenReturn(dataset);
        when(whoDetector.detect(dataset)).thenThrow(new ArithmeticException("division by zero"));

        DetectorOutcome outcome = service.runDetector(TENANT, RUN, PatternType.WHO);

        assertThat(outcome).isEqualTo(DetectorOutcome.DETECTOR_FAILED);
        verify(patternStore, never()).save(any(), any());
        assertThat(lastSavedRecord().getErrorMessage()).contains("division by zero");
    }

    @Test
    @DisplayName("reports INSUFFICIENT_DATA for results below the detector floors")
    void insufficientData() {
        DetectionResult result = DetectionResult.insufficient(WhoPatternPayload.defaults(2, 8), 8);
        when(datasetLoader.load(TENANT)).thenReturn(dataset);
        when(whoDetector.detect(dataset)).thenReturn(result);
        when(patternStore.save(TENANT, result)).thenReturn(StoreOutcome.RETAINED_PREVIOUS);

        assertThat(service.runDetector(TENANT, RUN, PatternType.WHO)).isEqualTo(DetectorOutcome.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("fails a pattern type that has no detector")
    void missingDetector() {
        assertThat(service.runDetector(TENANT, RUN, PatternType.HOW)).isEqualTo(DetectorOutcome.DETECTOR_FAILED);
        verify(runRecordRepository, atLeastOnce())
                .findByRunIdAndTenantIdAndPatternType(eq(RUN), eq(TENANT), eq(PatternType.HOW));
    }
}
