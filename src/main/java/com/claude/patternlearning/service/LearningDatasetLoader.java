package com.claude.patternlearning.service;

import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.detector.LeadSample;
import com.claude.patternlearning.detector.LearningDataset;
import com.claude.patternlearning.detector.TouchSample;
import com.claude.patternlearning.entity.Lead;
import com.claude.patternlearning.entity.Touch;
import com.claude.patternlearning.repository.LeadRepository;
import com.claude.patternlearning.repository.TouchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads one tenant's terminal leads inside the lookback window, and their touches, into
 * an immutable {@link LearningDataset}.
 */
@Service
@Slf4j
public class LearningDatasetLoader {

    private final LeadRepository leadRepository;
    private final TouchRepository touchRepository;
    private final PatternLearningProperties properties;
    private final Clock clock;

    public LearningDatasetLoader(LeadRepository leadRepository,
                                 TouchRepository touchRepository,
                                 PatternLearningProperties properties,
                                 Clock clock) {
        this.leadRepository = leadRepository;
        this.touchRepository = touchRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public LearningDataset load(String tenantId) {
        LocalDateTime asOf = LocalDateTime.now(clock);
        LocalDateTime since = asOf.minusDays(properties.getDetection().getLookbackDays());

        List<Lead> leads = leadRepository.findByTenantAndStatusSince(tenantId, Lead.LeadStatus.TERMINAL, since);
        Set<Long> leadIds = new HashSet<>();
        for (Lead lead : leads) {
            leadIds.add(lead.getId());
        }

        List<TouchSample> touches = touchRepository.findByTenantIdOrderByIdAsc(tenantId).stream()
                .filter(touch -> leadIds.contains(touch.getLeadId()))
                .map(TouchSample::from)
                .collect(Collectors.toList());

        log.debug("[{}] dataset loaded: {} terminal leads, {} touches since {}",
                tenantId, leads.size(), touches.size(), since);

        return LearningDataset.builder()
                .tenantId(tenantId)
                .asOf(asOf)
                .leads(Collections.unmodifiableList(leads.stream().map(LeadSample::from).collect(Collectors.toList())))
                .touches(Collections.unmodifiableList(touches))
                .build();
    }
}
