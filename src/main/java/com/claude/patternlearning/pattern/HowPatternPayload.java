package com.claude.patternlearning.pattern;

import com.claude.patternlearning.entity.PatternType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Which channels and channel sequences convert. Read by the channel allocator.
 */
@Value
@Builder
@Jacksonized
public class HowPatternPayload implements PatternPayload {

    Map<String, Double> bookingChannelDistribution;
    Map<String, ChannelStat> firstTouchEffectiveness;
    String bestFirstChannel;
    Map<String, ChannelStat> multiChannelLift;
    String optimalChannelCount;
    List<SequenceStat> winningSequences;
    Map<String, Map<String, ChannelStat>> channelEffectivenessByTier;
    Map<String, Map<String, Double>> channelTransitions;

    @Override
    public PatternType patternType() {
        return PatternType.HOW;
    }

    public static HowPatternPayload defaults() {
        return HowPatternPayload.builder()
                .bookingChannelDistribution(Collections.emptyMap())
                .firstTouchEffectiveness(Collections.emptyMap())
                .multiChannelLift(Collections.emptyMap())
                .winningSequences(Collections.emptyList())
                .channelEffectivenessByTier(Collections.emptyMap())
                .channelTransitions(Collections.emptyMap())
                .build();
    }

    /**
     * A fixed-length channel sequence, absent slots rendered as {@code none}.
     */
    @Value
    @Builder
    @Jacksonized
    public static class SequenceStat {
        List<String> sequence;
        double conversionRate;
        int conversions;
        int sampleSize;
    }
}
