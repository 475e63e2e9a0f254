package com.claude.patternlearning.pattern;

import com.claude.patternlearning.entity.PatternType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Which content converts. Read as guidance text by the message generator.
 */
@Value
@Builder
@Jacksonized
public class WhatPatternPayload implements PatternPayload {

    SubjectPatterns subjectPatterns;
    PainPoints painPoints;
    Ctas ctas;
    Angles angles;
    Map<String, LengthBand> optimalLength;
    Map<String, Double> personalizationLift;
    int convertingTouches;
    int totalTouches;
    int malformedSnapshotsSkipped;

    @Override
    public PatternType patternType() {
        return PatternType.WHAT;
    }

    public static WhatPatternPayload defaults(int convertingTouches, int totalTouches, int malformed) {
        return WhatPatternPayload.builder()
                .subjectPatterns(new SubjectPatterns(Collections.emptyList(), Collections.emptyList()))
                .painPoints(new PainPoints(Collections.emptyList(), Collections.emptyList()))
                .ctas(new Ctas(Collections.emptyList()))
                .angles(new Angles(Collections.emptyList()))
                .optimalLength(Collections.emptyMap())
                .personalizationLift(Collections.emptyMap())
                .convertingTouches(convertingTouches)
                .totalTouches(totalTouches)
                .malformedSnapshotsSkipped(malformed)
                .build();
    }

    @Value
    @Builder
    @Jacksonized
    public static class SubjectPatterns {
        List<FeatureLift> winning;
        List<FeatureLift> losing;
    }

    @Value
    @Builder
    @Jacksonized
    public static class PainPoints {
        List<FeatureLift> effective;
        List<FeatureLift> ineffective;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Ctas {
        List<FeatureLift> effective;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Angles {
        List<FeatureLift> rankings;
    }

    /**
     * Target word count for one channel with its tolerance band.
     */
    @Value
    @Builder
    @Jacksonized
    public static class LengthBand {
        int targetWords;
        int minWords;
        int maxWords;
        int medianChars;
        int sampleSize;
    }
}
