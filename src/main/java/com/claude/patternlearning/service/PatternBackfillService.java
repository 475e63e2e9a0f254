package com.claude.patternlearning.service;

import com.claude.patternlearning.dto.BackfillResult;
import com.claude.patternlearning.dto.TenantLearningResult;
import com.claude.patternlearning.entity.Lead;
import com.claude.patternlearning.entity.Touch;
import com.claude.patternlearning.exception.MalformedContentException;
import com.claude.patternlearning.extractor.ContentFeatureExtractor;
import com.claude.patternlearning.extractor.ScoreComponentCalculator;
import com.claude.patternlearning.pattern.PatternJsonCodec;
import com.claude.patternlearning.pattern.ScoreComponent;
import com.claude.patternlearning.pattern.ScoringWeights;
import com.claude.patternlearning.repository.LeadRepository;
import com.claude.patternlearning.repository.TouchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Repairs a tenant's historical leads and touches so they can be learned from, then runs
 * learning for the tenant.
 *
 * <p>Repairs, in order: content snapshots rebuilt from the raw body, score components
 * computed for unscored leads, and the booking flag placed on converted leads that lack one.
 * All repairs commit in one transaction before learning starts.
 */
@Service
@Slf4j
public class PatternBackfillService {

    private final LeadRepository leadRepository;
    private final TouchRepository touchRepository;
    private final ContentFeatureExtractor contentFeatureExtractor;
    private final ScoreComponentCalculator scoreComponentCalculator;
    private final PatternJsonCodec codec;
    private final TenantService tenantService;
    private final PatternLearningOrchestrator orchestrator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public PatternBackfillService(LeadRepository leadRepository,
                                  TouchRepository touchRepository,
                                  ContentFeatureExtractor contentFeatureExtractor,
                                  ScoreComponentCalculator scoreComponentCalculator,
                                  PatternJsonCodec codec,
                                  TenantService tenantService,
                                  PatternLearningOrchestrator orchestrator,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock) {
        this.leadRepository = leadRepository;
        this.touchRepository = touchRepository;
        this.contentFeatureExtractor = contentFeatureExtractor;
        this.scoreComponentCalculator = scoreComponentCalculator;
        this.codec = codec;
        this.tenantService = tenantService;
        this.orchestrator = orchestrator;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public BackfillResult backfillTenant(String tenantId) {
        tenantService.getTenant(tenantId);
        log.info("[{}] backfill started", tenantId);

        BackfillResult result = transactionTemplate.execute(status -> repair(tenantId));
        log.info("[{}] backfill repaired {} snapshots, {} scores, {} booking flags",
                tenantId, result.getSnapshotsRebuilt(), result.getScoresComputed(), result.getBookingFlagsSet());

        TenantLearningResult learning = orchestrator.runLearningForTenant(tenantId);
        result.setLearning(learning);
        log.info("[{}] backfill finished, learning {}", tenantId, learning.getStatus());
        return result;
    }

    private BackfillResult repair(String tenantId) {
        Map<Long, Lead> leads = new LinkedHashMap<>();
        for (Lead lead : leadRepository.findByTenantIdOrderByIdAsc(tenantId)) {
            leads.put(lead.getId(), lead);
        }
        List<Touch> touches = touchRepository.findByTenantIdOrderByIdAsc(tenantId);

        int snapshots = rebuildSnapshots(touches, leads);
        int scores = computeScores(leads.values());
        int bookings = flagBookingTouches(touches, leads);

        return BackfillResult.builder()
                .tenantId(tenantId)
                .snapshotsRebuilt(snapshots)
                .scoresComputed(scores)
                .bookingFlagsSet(bookings)
                .build();
    }

    int rebuildSnapshots(List<Touch> touches, Map<Long, Lead> leads) {
        int rebuilt = 0;
        for (Touch touch : touches) {
            if (touch.getBody() == null || hasValidSnapshot(touch)) {
                continue;
            }
            touch.setContentSnapshot(codec.encode(contentFeatureExtractor.extract(touch, leads.get(touch.getLeadId()))));
            touchRepository.save(touch);
            rebuilt++;
        }
        return rebuilt;
    }

    private boolean hasValidSnapshot(Touch touch) {
        try {
            codec.parseSnapshot(touch.getContentSnapshot());
            return true;
        } catch (MalformedContentException e) {
            log.debug("[{}] touch {} needs a new snapshot: {}", touch.getTenantId(), touch.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Leads scored before component snapshots existed get components, a score under the
     * default weights and those weights recorded as used.
     */
    int computeScores(Iterable<Lead> leads) {
        LocalDateTime now = LocalDateTime.now(clock);
        int computed = 0;
        for (Lead lead : leads) {
            if (hasAllComponents(lead)) {
                continue;
            }
            Map<String, Double> components = scoreComponentCalculator.calculate(lead);
            lead.setScoreComponents(components);
            lead.setScore(scoreComponentCalculator.score(components, ScoringWeights.DEFAULT));
            lead.setWeightsUsed(ScoringWeights.DEFAULT.toMap());
            lead.setScoredAt(now);
            leadRepository.save(lead);
            computed++;
        }
        return computed;
    }

    private boolean hasAllComponents(Lead lead) {
        if (!lead.hasScoreComponents()) {
            return false;
        }
        for (ScoreComponent component : ScoreComponent.values()) {
            if (lead.getScoreComponents().get(component.getKey()) == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * For each converted lead without a booking touch, flags the latest touch sent at or
     * before the conversion time, or the latest touch when none precedes it.
     */
    int flagBookingTouches(List<Touch> touches, Map<Long, Lead> leads) {
        Map<Long, List<Touch>> byLead = new LinkedHashMap<>();
        for (Touch touch : touches) {
            byLead.computeIfAbsent(touch.getLeadId(), id -> new ArrayList<>()).add(touch);
        }

        int flagged = 0;
        for (Map.Entry<Long, List<Touch>> entry : byLead.entrySet()) {
            Lead lead = leads.get(entry.getKey());
            List<Touch> sequence = entry.getValue();
            if (lead == null || !lead.isConverted() || sequence.stream().anyMatch(Touch::isBookingTouch)) {
                continue;
            }
            sequence.sort(Comparator.comparing(Touch::getSentAt).thenComparing(Touch::getId));

            Touch booking = sequence.get(sequence.size() - 1);
            if (lead.getConvertedAt() != null) {
                for (Touch touch : sequence) {
                    if (!touch.getSentAt().isAfter(lead.getConvertedAt())) {
                        booking = touch;
                    }
                }
            }
            booking.setLedToBooking(true);
            touchRepository.save(booking);
            flagged++;
        }
        return flagged;
    }
}
