package com.claude.patternlearning.store;

import com.claude.patternlearning.detector.DetectionResult;
import com.claude.patternlearning.entity.ConversionPattern;
import com.claude.patternlearning.entity.PatternHistory;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.pattern.HowPatternPayload;
import com.claude.patternlearning.pattern.ScoringWeights;
import com.claude.patternlearning.pattern.WhoPatternPayload;
import com.claude.patternlearning.repository.ConversionPatternRepository;
import com.claude.patternlearning.repository.PatternHistoryRepository;
import com.claude.patternlearning.repository.TenantWeightCacheRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@DisplayName("PatternStore")
class PatternStoreTest {

    private static final String TENANT = "store-tenant";
    private static final ScoringWeights LEARNED = ScoringWeights.of(new double[]{0.15, 0.35, 0.20, 0.15});

    @Autowired
    private PatternStore patternStore;

    @Autowired
    private WeightCacheService weightCacheService;

    @Autowired
    private ConversionPatternRepository patternRepository;

    @Autowired
    private PatternHistoryRepository historyRepository;

    @Autowired
    private TenantWeightCacheRepository weightCacheRepository;

    @BeforeEach
    void cleanUp() {
        historyRepository.deleteAll();
        patternRepository.deleteAll();
        weightCacheRepository.deleteAll();
        weightCacheService.evict(TENANT);
    }

    private static DetectionResult learnedWho(int sampleSize, double confidence) {
        WhoPatternPayload payload = WhoPatternPayload.builder()
                .titleRankings(List.of())
                .industryRankings(List.of())
                .timingSignals(WhoPatternPayload.TimingSignals.NEUTRAL)
                .recommendedWeights(LEARNED)
                .optimizerStatus("CONVERGED")
                .convertedCount(40)
                .totalCount(sampleSize)
                .build();
        return DetectionResult.of(payload, sampleSize, confidence);
    }

    @Test
    @DisplayName("promotes a confident result and publishes its weights")
    void promotes() {
        assertThat(weightCacheService.getWeights(TENANT).isLearned()).isFalse();

        StoreOutcome outcome = patternStore.save(TENANT, learnedWho(200, 0.62));

        assertThat(outcome).isEqualTo(StoreOutcome.PROMOTED);
        ConversionPattern current = patternStore.findCurrent(TENANT, PatternType.WHO).orElseThrow();
        assertThat(current.getVersion()).isEqualTo(1);
        assertThat(current.getSampleSize()).isEqualTo(200);
        assertThat(patternStore.lifecycleOf(current)).isEqualTo(PatternLifecycle.VALID);
        assertThat(((WhoPatternPayload) patternStore.decode(current)).getRecommendedWeights()).isEqualTo(LEARNED);

        TenantWeights weights = weightCacheService.getWeights(TENANT);
        assertThat(weights.isLearned()).isTrue();
        assertThat(weights.getWeights()).isEqualTo(LEARNED);
        assertThat(weights.getSampleCount()).isEqualTo(200);
    }

    @Test
    @DisplayName("keeps the previous pattern when a newer result is not good enough")
    void retainsPrevious() {
        patternStore.save(TENANT, learnedWho(200, 0.62));

        StoreOutcome insufficient = patternStore.save(TENANT,
                DetectionResult.insufficient(WhoPatternPayload.defaults(2, 12), 12));
        StoreOutcome unconfident = patternStore.save(TENANT, learnedWho(200, 0.05));

        assertThat(insufficient).isEqualTo(StoreOutcome.RETAINED_PREVIOUS);
        assertThat(unconfident).isEqualTo(StoreOutcome.RETAINED_PREVIOUS);
        assertThat(patternStore.findCurrent(TENANT, PatternType.WHO).orElseThrow().getVersion()).isEqualTo(1);
        assertThat(weightCacheService.getWeights(TENANT).getWeights()).isEqualTo(LEARNED);

        List<PatternHistory> history = patternStore.history(TENANT, PatternType.WHO);
        assertThat(history).extracting(PatternHistory::getVersion).containsExactly(3, 2, 1);
        assertThat(history).extracting(PatternHistory::getPromoted).containsExactly(false, false, true);
        assertThat(history.get(1).getInsufficientData()).isTrue();
    }

    @Test
    @DisplayName("rejects results below the minimum sample size")
    void smallSample() {
        StoreOutcome outcome = patternStore.save(TENANT,
                DetectionResult.of(HowPatternPayload.defaults(), 19, 0.9));

        assertThat(outcome).isEqualTo(StoreOutcome.RETAINED_PREVIOUS);
        assertThat(patternStore.findCurrent(TENANT, PatternType.HOW)).isEmpty();
        assertThat(patternStore.lifecycleOf(null)).isEqualTo(PatternLifecycle.ABSENT);
        assertThat(patternStore.history(TENANT, PatternType.HOW)).hasSize(1);
    }

    @Test
    @DisplayName("versions each pattern type independently")
    void independentVersions() {
        patternStore.save(TENANT, learnedWho(200, 0.62));
        patternStore.save(TENANT, DetectionResult.of(HowPatternPayload.defaults(), 80, 0.4));
        patternStore.save(TENANT, DetectionResult.of(HowPatternPayload.defaults(), 90, 0.5));

        assertThat(patternStore.listCurrent(TENANT))
                .extracting(ConversionPattern::getPatternType, ConversionPattern::getVersion)
                .containsExactlyInAnyOrder(
                        tuple(PatternType.WHO, 1),
                        tuple(PatternType.HOW, 2));
    }
}
