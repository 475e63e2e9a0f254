package com.claude.patternlearning.service;

import com.claude.patternlearning.detector.DetectionResult;
import com.claude.patternlearning.detector.LearningDataset;
import com.claude.patternlearning.detector.PatternDetector;
import com.claude.patternlearning.entity.LearningRunRecord;
import com.claude.patternlearning.entity.LearningRunRecord.DetectorOutcome;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.exception.DetectorException;
import com.claude.patternlearning.repository.LearningRunRecordRepository;
import com.claude.patternlearning.store.PatternStore;
import com.claude.patternlearning.store.StoreOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a single detector for a single tenant and records the outcome.
 *
 * <p>Failures stay inside this call: a detector that throws yields DETECTOR_FAILED, a
 * write that still fails after retries yields STORE_FAILED. In both cases the current
 * pattern is left untouched and the other detectors of the run carry on.
 */
@Service
@Slf4j
public class TenantLearningService {

    private final Map<PatternType, PatternDetector> detectors = new EnumMap<>(PatternType.class);
    private final LearningDatasetLoader datasetLoader;
    private final PatternStore patternStore;
    private final LearningRunRecordRepository runRecordRepository;
    private final RetryTemplate retryTemplate;
    private final Clock clock;

    public TenantLearningService(List<PatternDetector> detectors,
                                 LearningDatasetLoader datasetLoader,
                                 PatternStore patternStore,
                                 LearningRunRecordRepository runRecordRepository,
                                 @Qualifier("learningRetryTemplate") RetryTemplate retryTemplate,
                                 Clock clock) {
        for (PatternDetector detector : detectors) {
            this.detectors.put(detector.getPatternType(), detector);
        }
        this.datasetLoader = datasetLoader;
        this.patternStore = patternStore;
        this.runRecordRepository = runRecordRepository;
        this.retryTemplate = retryTemplate;
        this.clock = clock;
    }

    public DetectorOutcome runDetector(String tenantId, String runId, PatternType patternType) {
        LearningRunRecord record = runRecordRepository
                .findByRunIdAndTenantIdAndPatternType(runId, tenantId, patternType)
                .orElseGet(LearningRunRecord::new);
        record.setRunId(runId);
        record.setTenantId(tenantId);
        record.setPatternType(patternType);
        record.startProcessing(LocalDateTime.now(clock));
        record = runRecordRepository.save(record);

        DetectionResult result;
        try {
            result = detect(tenantId, patternType);
        } catch (DetectorException e) {
            log.error("[{}] {} detector failed, current pattern kept: {}", tenantId, patternType, e.getMessage(), e);
            record.failProcessing(DetectorOutcome.DETECTOR_FAILED, e.getMessage(), LocalDateTime.now(clock));
            runRecordRepository.save(record);
            return DetectorOutcome.DETECTOR_FAILED;
        }

        DetectorOutcome outcome;
        try {
            StoreOutcome stored = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("[{}] {} store attempt {} after: {}", tenantId, patternType,
                            context.getRetryCount() + 1, context.getLastThrowable().getMessage());
                }
                return patternStore.save(tenantId, result);
            });
            outcome = toOutcome(result, stored);
        } catch (RuntimeException e) {
            log.error("[{}] {} store failed after retries, current pattern kept: {}",
                    tenantId, patternType, e.getMessage(), e);
            record.failProcessing(DetectorOutcome.STORE_FAILED, e.getMessage(), LocalDateTime.now(clock));
            runRecordRepository.save(record);
            return DetectorOutcome.STORE_FAILED;
        }

        record.completeProcessing(outcome, result.getSampleSize(), result.getConfidence(), LocalDateTime.now(clock));
        runRecordRepository.save(record);
        log.info("[{}] {} finished: {} (sample {}, confidence {})", tenantId, patternType, outcome,
                result.getSampleSize(), String.format("%.3f", result.getConfidence()));
        return outcome;
    }

    private DetectionResult detect(String tenantId, PatternType patternType) {
        PatternDetector detector = detectors.get(patternType);
        if (detector == null) {
            throw new DetectorException(tenantId, patternType,
                    new IllegalStateException("No detector registered for " + patternType));
        }
        try {
            LearningDataset dataset = retryTemplate.execute(context -> datasetLoader.load(tenantId));
            return detector.detect(dataset);
        } catch (DetectorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DetectorException(tenantId, patternType, e);
        }
    }

    private DetectorOutcome toOutcome(DetectionResult result, StoreOutcome stored) {
        if (!result.isSufficientData()) {
            return DetectorOutcome.INSUFFICIENT_DATA;
        }
        return stored == StoreOutcome.PROMOTED ? DetectorOutcome.STORED : DetectorOutcome.RETAINED_PREVIOUS;
    }
}
