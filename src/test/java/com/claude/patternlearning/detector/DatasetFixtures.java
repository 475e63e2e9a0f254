package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.Channel;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builders for in-memory learning datasets.
 */
final class DatasetFixtures {

    static final String TENANT = "tenant-a";
    static final LocalDateTime AS_OF = LocalDateTime.of(2026, 3, 1, 12, 0);

    private final List<LeadSample> leads = new ArrayList<>();
    private final List<TouchSample> touches = new ArrayList<>();
    private long nextLeadId = 1;
    private long nextTouchId = 1;

    static DatasetFixtures dataset() {
        return new DatasetFixtures();
    }

    DatasetFixtures leads(int count, boolean converted, String title) {
        for (int i = 0; i < count; i++) {
            lead(LeadSample.builder().title(title).converted(converted));
        }
        return this;
    }

    long lead(LeadSample.LeadSampleBuilder builder) {
        long id = nextLeadId++;
        LeadSample lead = builder.id(id).build();
        if (lead.getScoreComponents() == null) {
            lead = builder.scoreComponents(Collections.emptyMap()).build();
        }
        leads.add(lead);
        return id;
    }

    long lead(boolean converted, Integer score, Map<String, Double> components) {
        return lead(LeadSample.builder().converted(converted).score(score).scoreComponents(components));
    }

    DatasetFixtures touch(long leadId, Channel channel, LocalDateTime sentAt, int touchNumber, boolean booking) {
        return touch(leadId, channel, sentAt, touchNumber, booking, null);
    }

    DatasetFixtures touch(long leadId, Channel channel, LocalDateTime sentAt, int touchNumber,
                          boolean booking, String snapshot) {
        touches.add(TouchSample.builder()
                .id(nextTouchId++)
                .leadId(leadId)
                .channel(channel)
                .sentAt(sentAt)
                .touchNumber(touchNumber)
                .bookingTouch(booking)
                .contentSnapshot(snapshot)
                .build());
        return this;
    }

    /**
     * One journey: a lead whose touches go out a day apart, the last one booking if converted.
     */
    DatasetFixtures journey(boolean converted, LocalDateTime start, Channel... channels) {
        long leadId = lead(converted, null, Collections.emptyMap());
        for (int i = 0; i < channels.length; i++) {
            touch(leadId, channels[i], start.plusDays(i), i + 1, converted && i == channels.length - 1);
        }
        return this;
    }

    LearningDataset build() {
        return LearningDataset.builder()
                .tenantId(TENANT)
                .asOf(AS_OF)
                .leads(new ArrayList<>(leads))
                .touches(new ArrayList<>(touches))
                .build();
    }
}
