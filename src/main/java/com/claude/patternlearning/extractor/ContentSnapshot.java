package com.claude.patternlearning.extractor;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured features of one outbound message, stored as JSON on the touch at send time.
 */
@Value
@Builder
@Jacksonized
public class ContentSnapshot {
    String channel;
    String subject;
    List<String> painPoints;
    String cta;
    List<String> angles;
    boolean hasCompanyMention;
    boolean hasFirstName;
    boolean hasRecentNews;
    boolean hasMutualConnection;
    boolean hasIndustrySpecific;
    int wordCount;
    int charCount;
    Integer touchNumber;
    String sequenceId;
}
