package com.claude.patternlearning.pattern;

import com.claude.patternlearning.entity.PatternType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;

/**
 * Which leads convert: ranked attribute values, timing-signal lifts and learned scoring weights.
 */
@Value
@Builder
@Jacksonized
public class WhoPatternPayload implements PatternPayload {

    List<RankedValue> titleRankings;
    List<RankedValue> industryRankings;
    SizeAnalysis sizeAnalysis;
    TimingSignals timingSignals;
    ScoringWeights recommendedWeights;
    String optimizerStatus;
    double overallConversionRate;
    int convertedCount;
    int totalCount;

    @Override
    public PatternType patternType() {
        return PatternType.WHO;
    }

    public static WhoPatternPayload defaults(int convertedCount, int totalCount) {
        return WhoPatternPayload.builder()
                .titleRankings(Collections.emptyList())
                .industryRankings(Collections.emptyList())
                .sizeAnalysis(SizeAnalysis.builder()
                        .distribution(Collections.emptyList())
                        .build())
                .timingSignals(TimingSignals.NEUTRAL)
                .recommendedWeights(ScoringWeights.DEFAULT)
                .optimizerStatus("INSUFFICIENT_DATA")
                .convertedCount(convertedCount)
                .totalCount(totalCount)
                .build();
    }

    @Value
    @Builder
    @Jacksonized
    public static class SizeAnalysis {
        String sweetSpot;
        List<RankedValue> distribution;
    }

    @Value
    @Builder
    @Jacksonized
    public static class TimingSignals {
        public static final TimingSignals NEUTRAL = new TimingSignals(1.0, 1.0, 1.0);

        double newRoleLift;
        double hiringLift;
        double fundedLift;
    }
}
