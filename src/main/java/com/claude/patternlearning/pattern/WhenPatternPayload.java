package com.claude.patternlearning.pattern;

import com.claude.patternlearning.entity.PatternType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * When to reach out: best days and hours, where in the sequence bookings happen,
 * the spacing between touches and how long conversions take.
 */
@Value
@Builder
@Jacksonized
public class WhenPatternPayload implements PatternPayload {

    List<RankedValue> bestDays;
    List<RankedValue> bestHours;
    Map<String, Double> convertingTouchDistribution;
    Integer peakConvertingTouch;
    double avgTouchesToConvert;
    Map<String, Integer> optimalSequenceGaps;
    ConversionTiming conversionTiming;

    @Override
    public PatternType patternType() {
        return PatternType.WHEN;
    }

    public static Map<String, Integer> defaultGaps() {
        Map<String, Integer> gaps = new TreeMap<>();
        gaps.put("touch_1_to_2", 2);
        gaps.put("touch_2_to_3", 3);
        gaps.put("touch_3_to_4", 4);
        return gaps;
    }

    public static WhenPatternPayload defaults() {
        return WhenPatternPayload.builder()
                .bestDays(Collections.emptyList())
                .bestHours(Collections.emptyList())
                .convertingTouchDistribution(Collections.emptyMap())
                .optimalSequenceGaps(defaultGaps())
                .conversionTiming(ConversionTiming.EMPTY)
                .build();
    }

    /**
     * Days from first to last touch across converted sequences.
     */
    @Value
    @Builder
    @Jacksonized
    public static class ConversionTiming {
        public static final ConversionTiming EMPTY = new ConversionTiming(0, 0, 0, 0, 0, 0);

        double avg;
        double median;
        double p50;
        double p80;
        double p95;
        int sampleSize;
    }
}
