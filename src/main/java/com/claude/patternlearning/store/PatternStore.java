package com.claude.patternlearning.store;

import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.detector.DetectionResult;
import com.claude.patternlearning.entity.ConversionPattern;
import com.claude.patternlearning.entity.PatternHistory;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.exception.PatternStoreException;
import com.claude.patternlearning.pattern.PatternJsonCodec;
import com.claude.patternlearning.pattern.PatternPayload;
import com.claude.patternlearning.pattern.WhoPatternPayload;
import com.claude.patternlearning.repository.ConversionPatternRepository;
import com.claude.patternlearning.repository.PatternHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Current patterns and their append-only history.
 *
 * <p>Every detection result is written to {@code pattern_history}. It replaces the current
 * pattern only when it has enough data and clears the sample-size and confidence
 * thresholds; otherwise the previous pattern keeps serving. Both writes, and the weight
 * cache refresh for WHO, share one transaction per call.
 */
@Service
@Slf4j
public class PatternStore {

    private final ConversionPatternRepository patternRepository;
    private final PatternHistoryRepository historyRepository;
    private final WeightCacheService weightCacheService;
    private final PatternJsonCodec codec;
    private final PatternLearningProperties properties;
    private final Clock clock;

    public PatternStore(ConversionPatternRepository patternRepository,
                        PatternHistoryRepository historyRepository,
                        WeightCacheService weightCacheService,
                        PatternJsonCodec codec,
                        PatternLearningProperties properties,
                        Clock clock) {
        this.patternRepository = patternRepository;
        this.historyRepository = historyRepository;
        this.weightCacheService = weightCacheService;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Writes one result. Database failures surface as {@link PatternStoreException} with the
     * original data access exception as cause.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public StoreOutcome save(String tenantId, DetectionResult result) {
        try {
            return write(tenantId, result);
        } catch (DataAccessException e) {
            throw new PatternStoreException(String.format("Failed to store %s pattern for tenant %s",
                    result.getPatternType().getCode(), tenantId), e);
        }
    }

    private StoreOutcome write(String tenantId, DetectionResult result) {
        PatternType patternType = result.getPatternType();
        LocalDateTime computedAt = LocalDateTime.now(clock);
        LocalDateTime validUntil = computedAt.plusDays(properties.getStore().getValidityDays());
        String payload = codec.encode(result.getPayload());
        int version = (int) historyRepository.countByTenantIdAndPatternType(tenantId, patternType) + 1;
        boolean promote = isPromotable(result);

        PatternHistory history = new PatternHistory();
        history.setTenantId(tenantId);
        history.setPatternType(patternType);
        history.setVersion(version);
        history.setPayload(payload);
        history.setSampleSize(result.getSampleSize());
        history.setConfidence(result.getConfidence());
        history.setComputedAt(computedAt);
        history.setValidUntil(validUntil);
        history.setPromoted(promote);
        history.setInsufficientData(!result.isSufficientData());
        historyRepository.save(history);

        if (!promote) {
            log.info("[{}] {} v{} kept in history only (sample {}, confidence {}, sufficient {})",
                    tenantId, patternType, version, result.getSampleSize(),
                    String.format("%.3f", result.getConfidence()), result.isSufficientData());
            return StoreOutcome.RETAINED_PREVIOUS;
        }

        ConversionPattern current = patternRepository.findByTenantIdAndPatternType(tenantId, patternType)
                .orElseGet(ConversionPattern::new);
        current.setTenantId(tenantId);
        current.setPatternType(patternType);
        current.setVersion(version);
        current.setPayload(payload);
        current.setSampleSize(result.getSampleSize());
        current.setConfidence(result.getConfidence());
        current.setComputedAt(computedAt);
        current.setValidUntil(validUntil);
        patternRepository.save(current);

        if (patternType == PatternType.WHO) {
            WhoPatternPayload who = (WhoPatternPayload) result.getPayload();
            weightCacheService.refresh(tenantId, who.getRecommendedWeights(), result.getSampleSize(),
                    computedAt, validUntil);
        }

        log.info("[{}] {} v{} promoted (sample {}, confidence {}, valid until {})",
                tenantId, patternType, version, result.getSampleSize(),
                String.format("%.3f", result.getConfidence()), validUntil);
        return StoreOutcome.PROMOTED;
    }

    boolean isPromotable(DetectionResult result) {
        PatternLearningProperties.Store store = properties.getStore();
        return result.isSufficientData()
                && result.getSampleSize() >= store.getMinSampleSize()
                && result.getConfidence() >= store.getMinConfidence();
    }

    @Transactional(readOnly = true)
    public Optional<ConversionPattern> findCurrent(String tenantId, PatternType patternType) {
        return patternRepository.findByTenantIdAndPatternType(tenantId, patternType);
    }

    @Transactional(readOnly = true)
    public List<ConversionPattern> listCurrent(String tenantId) {
        return patternRepository.findByTenantIdOrderByPatternTypeAsc(tenantId);
    }

    @Transactional(readOnly = true)
    public List<ConversionPattern> listAllCurrent() {
        return patternRepository.findAllByOrderByTenantIdAscPatternTypeAsc();
    }

    /**
     * History rows for one pair, newest version first.
     */
    @Transactional(readOnly = true)
    public List<PatternHistory> history(String tenantId, PatternType patternType) {
        return historyRepository.findByTenantIdAndPatternTypeOrderByVersionDesc(tenantId, patternType);
    }

    public PatternPayload decode(ConversionPattern pattern) {
        return codec.decodePayload(pattern.getPatternType(), pattern.getPayload());
    }

    public PatternLifecycle lifecycleOf(ConversionPattern pattern) {
        return PatternLifecycle.of(pattern != null ? pattern.getValidUntil() : null,
                LocalDateTime.now(clock), properties.getStore().getExpiringWindowDays());
    }
}
