package com.claude.patternlearning.detector;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of one tenant's terminal leads and their touches, the sole input of every detector.
 * Active leads are excluded from both pools.
 */
@Value
@Builder
public class LearningDataset {

    private static final Comparator<TouchSample> CHRONOLOGICAL = Comparator
            .comparing(TouchSample::getSentAt)
            .thenComparing(t -> t.getTouchNumber() != null ? t.getTouchNumber() : 0)
            .thenComparing(TouchSample::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    String tenantId;
    LocalDateTime asOf;
    List<LeadSample> leads;
    List<TouchSample> touches;

    public Map<Long, LeadSample> leadsById() {
        Map<Long, LeadSample> index = new LinkedHashMap<>();
        for (LeadSample lead : leads) {
            index.put(lead.getId(), lead);
        }
        return index;
    }

    /**
     * Touches grouped per lead in time order, leads in id order.
     */
    public Map<Long, List<TouchSample>> sequencesByLead() {
        Map<Long, List<TouchSample>> sequences = new TreeMap<>();
        for (TouchSample touch : touches) {
            sequences.computeIfAbsent(touch.getLeadId(), id -> new ArrayList<>()).add(touch);
        }
        for (List<TouchSample> sequence : sequences.values()) {
            sequence.sort(CHRONOLOGICAL);
        }
        return sequences;
    }
}
