package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.Lead;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable view of a lead with a terminal outcome.
 */
@Value
@Builder
public class LeadSample {
    Long id;
    String title;
    String industry;
    Integer employeeCount;
    String country;
    boolean newRole;
    boolean hiring;
    boolean recentlyFunded;
    boolean converted;
    Integer score;
    Map<String, Double> scoreComponents;

    public static LeadSample from(Lead lead) {
        return LeadSample.builder()
                .id(lead.getId())
                .title(lead.getTitle())
                .industry(lead.getIndustry())
                .employeeCount(lead.getEmployeeCount())
                .country(lead.getCountry())
                .newRole(Boolean.TRUE.equals(lead.getNewRole()))
                .hiring(Boolean.TRUE.equals(lead.getHiring()))
                .recentlyFunded(Boolean.TRUE.equals(lead.getRecentlyFunded()))
                .converted(lead.isConverted())
                .score(lead.getScore())
                .scoreComponents(lead.getScoreComponents() != null
                        ? Collections.unmodifiableMap(new TreeMap<>(lead.getScoreComponents()))
                        : Collections.emptyMap())
                .build();
    }
}
