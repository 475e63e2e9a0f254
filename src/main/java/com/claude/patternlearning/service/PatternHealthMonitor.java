package com.claude.patternlearning.service;

import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.dto.HealthReport;
import com.claude.patternlearning.dto.HealthWarning;
import com.claude.patternlearning.dto.HealthWarning.Kind;
import com.claude.patternlearning.dto.HealthWarning.Severity;
import com.claude.patternlearning.entity.ConversionPattern;
import com.claude.patternlearning.entity.LearningRunRecord;
import com.claude.patternlearning.entity.PatternHistory;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.entity.Tenant;
import com.claude.patternlearning.pattern.ScoringWeights;
import com.claude.patternlearning.pattern.WhoPatternPayload;
import com.claude.patternlearning.repository.LearningRunRecordRepository;
import com.claude.patternlearning.repository.PatternHistoryRepository;
import com.claude.patternlearning.store.PatternLifecycle;
import com.claude.patternlearning.store.PatternStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Daily scan over every tenant's patterns.
 *
 * <p>Current patterns are checked for freshness, sample size, confidence and, for WHO, the
 * weight constraints. Recent history and run records are checked for persistent low
 * confidence and repeated failures. Too many HIGH warnings escalate the report.
 */
@Service
@Slf4j
public class PatternHealthMonitor {

    static final double WEIGHT_SUM_TOLERANCE = 0.01;

    private final TenantService tenantService;
    private final PatternStore patternStore;
    private final PatternHistoryRepository historyRepository;
    private final LearningRunRecordRepository runRecordRepository;
    private final PatternLearningProperties properties;
    private final Clock clock;

    public PatternHealthMonitor(TenantService tenantService,
                                PatternStore patternStore,
                                PatternHistoryRepository historyRepository,
                                LearningRunRecordRepository runRecordRepository,
                                PatternLearningProperties properties,
                                Clock clock) {
        this.tenantService = tenantService;
        this.patternStore = patternStore;
        this.historyRepository = historyRepository;
        this.runRecordRepository = runRecordRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public HealthReport runHealthCheck() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<HealthWarning> warnings = new ArrayList<>();
        int checked = 0;

        for (Tenant tenant : tenantService.getAllTenants()) {
            String tenantId = tenant.getTenantId();
            Map<PatternType, ConversionPattern> current = patternStore.listCurrent(tenantId).stream()
                    .collect(Collectors.toMap(ConversionPattern::getPatternType, Function.identity()));
            for (PatternType type : PatternType.values()) {
                ConversionPattern pattern = current.get(type);
                if (pattern != null) {
                    checked++;
                    warnings.addAll(checkPattern(pattern));
                }
                checkHistory(tenantId, type).ifPresent(warnings::add);
                checkRuns(tenantId, type).ifPresent(warnings::add);
            }
        }

        int high = (int) warnings.stream().filter(w -> w.getSeverity() == Severity.HIGH).count();
        boolean escalated = high >= properties.getHealth().getEscalationThreshold();

        for (HealthWarning warning : warnings) {
            log.warn("pattern_health tenant={} type={} kind={} severity={} message=\"{}\"",
                    warning.getTenantId(), warning.getPatternType(), warning.getKind(),
                    warning.getSeverity(), warning.getMessage());
        }
        if (escalated) {
            log.error("pattern_health escalation: {} HIGH warnings (threshold {}) across {} patterns",
                    high, properties.getHealth().getEscalationThreshold(), checked);
        } else {
            log.info("pattern_health check done: {} patterns, {} warnings, {} HIGH", checked, warnings.size(), high);
        }

        return HealthReport.builder()
                .checkedAt(now)
                .patternsChecked(checked)
                .highSeverityCount(high)
                .escalated(escalated)
                .warnings(warnings)
                .build();
    }

    List<HealthWarning> checkPattern(ConversionPattern pattern) {
        PatternLearningProperties.Health health = properties.getHealth();
        List<HealthWarning> warnings = new ArrayList<>();

        PatternLifecycle lifecycle = patternStore.lifecycleOf(pattern);
        if (lifecycle == PatternLifecycle.EXPIRED) {
            warnings.add(warning(pattern, Kind.EXPIRED, Severity.HIGH,
                    "Pattern expired at " + pattern.getValidUntil()));
        } else if (lifecycle == PatternLifecycle.EXPIRING_SOON) {
            warnings.add(warning(pattern, Kind.EXPIRING_SOON, Severity.LOW,
                    "Pattern expires at " + pattern.getValidUntil()));
        }

        if (pattern.getSampleSize() < health.getMinSampleSize()) {
            warnings.add(warning(pattern, Kind.LOW_SAMPLE_SIZE, Severity.MEDIUM,
                    "Sample size " + pattern.getSampleSize() + " below " + health.getMinSampleSize()));
        }
        if (pattern.getConfidence() < health.getMinConfidence()) {
            warnings.add(warning(pattern, Kind.LOW_CONFIDENCE, Severity.MEDIUM,
                    String.format("Confidence %.3f below %.2f", pattern.getConfidence(), health.getMinConfidence())));
        }

        if (pattern.getPatternType() == PatternType.WHO) {
            ScoringWeights weights = ((WhoPatternPayload) patternStore.decode(pattern)).getRecommendedWeights();
            if (weights == null || !weights.isWithinBounds(WEIGHT_SUM_TOLERANCE)) {
                warnings.add(warning(pattern, Kind.WEIGHT_OUT_OF_BOUNDS, Severity.HIGH,
                        "Recommended weights violate bounds: " + (weights != null ? weights.toMap() : "missing")));
            }
        }
        return warnings;
    }

    private Optional<HealthWarning> checkHistory(String tenantId, PatternType type) {
        PatternLearningProperties.Health health = properties.getHealth();
        int window = health.getHistoryWindow();
        List<PatternHistory> recent = historyRepository.findRecent(tenantId, type, PageRequest.of(0, window));
        if (recent.size() < window
                || !recent.stream().allMatch(h -> h.getConfidence() < health.getMinConfidence())) {
            return Optional.empty();
        }
        return Optional.of(HealthWarning.builder()
                .tenantId(tenantId)
                .patternType(type.getCode())
                .kind(Kind.PERSISTENT_LOW_CONFIDENCE)
                .severity(Severity.HIGH)
                .message("Last " + window + " computations below confidence " + health.getMinConfidence())
                .build());
    }

    private Optional<HealthWarning> checkRuns(String tenantId, PatternType type) {
        int window = properties.getHealth().getHistoryWindow();
        List<LearningRunRecord> recent = runRecordRepository.findRecent(tenantId, type, PageRequest.of(0, window));
        if (recent.size() < window || !recent.stream().allMatch(LearningRunRecord::isFailed)) {
            return Optional.empty();
        }
        return Optional.of(HealthWarning.builder()
                .tenantId(tenantId)
                .patternType(type.getCode())
                .kind(Kind.REPEATED_RUN_FAILURE)
                .severity(Severity.HIGH)
                .message("Last " + window + " runs failed, latest: " + recent.get(0).getErrorMessage())
                .build());
    }

    private HealthWarning warning(ConversionPattern pattern, Kind kind, Severity severity, String message) {
        return HealthWarning.builder()
                .tenantId(pattern.getTenantId())
                .patternType(pattern.getPatternType().getCode())
                .kind(kind)
                .severity(severity)
                .message(message)
                .build();
    }
}
