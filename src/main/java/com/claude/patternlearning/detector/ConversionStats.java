package com.claude.patternlearning.detector;

import com.claude.patternlearning.pattern.RankedValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Shared arithmetic of the detectors.
 */
public final class ConversionStats {

    // confidence reaches 0.5 at this many positive samples
    static final double CONFIDENCE_MIDPOINT = 50.0;
    static final double CONFIDENCE_SCALE = 15.0;

    static final Comparator<RankedValue> BY_RATE_THEN_SAMPLE = Comparator
            .comparingDouble(RankedValue::getConversionRate).reversed()
            .thenComparing(Comparator.comparingInt(RankedValue::getSampleSize).reversed());

    private ConversionStats() {
    }

    public static double rate(int conversions, int total) {
        return total == 0 ? 0.0 : (double) conversions / total;
    }

    /**
     * Ratio of a subgroup rate to a baseline rate, 1.0 when the baseline carries no evidence.
     */
    public static double lift(double rate, double baseline) {
        return baseline > 0.0 ? rate / baseline : 1.0;
    }

    public static double confidence(int positives) {
        double value = 1.0 / (1.0 + Math.exp(-(positives - CONFIDENCE_MIDPOINT) / CONFIDENCE_SCALE));
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Element at index n/2 of the sorted values, so even-sized lists take the upper middle.
     */
    public static int upperMedian(List<Integer> values) {
        List<Integer> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return sorted.get(sorted.size() / 2);
    }

    public static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }

    /**
     * Ranks tallied values by rate, then sample size. The map's iteration order breaks
     * remaining ties, so callers pass a sorted map.
     */
    static List<RankedValue> rank(Map<String, Tally> tallies, double baseline, int minSample, int limit) {
        List<RankedValue> ranked = new ArrayList<>();
        for (Map.Entry<String, Tally> entry : tallies.entrySet()) {
            Tally tally = entry.getValue();
            if (tally.getTotal() < minSample) {
                continue;
            }
            ranked.add(RankedValue.builder()
                    .value(entry.getKey())
                    .conversionRate(tally.rate())
                    .lift(lift(tally.rate(), baseline))
                    .conversions(tally.getConversions())
                    .sampleSize(tally.getTotal())
                    .build());
        }
        ranked.sort(BY_RATE_THEN_SAMPLE);
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked;
    }
}
