package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.pattern.RankedValue;
import com.claude.patternlearning.pattern.WhenPatternPayload;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * WHEN detector - when to reach out.
 *
 * <p>Day and hour conversion rates over all touches, the position of the booking touch in
 * the sequence, the canonical spacing between touches and the first-to-last touch duration
 * of converted sequences.
 */
@Component
@Slf4j
public class WhenDetector implements PatternDetector {

    static final int MIN_CONVERTING = 5;
    static final int MIN_TOTAL = 20;
    static final int MIN_BUCKET_SAMPLE = 3;
    static final int MIN_GAP_DAYS = 1;
    static final int MAX_GAP_DAYS = 14;
    static final int MAX_GAP_POSITIONS = 5;
    static final double MAX_CONVERSION_DAYS = 90.0;

    private static final double SECONDS_PER_DAY = 86_400.0;

    @Override
    public PatternType getPatternType() {
        return PatternType.WHEN;
    }

    @Override
    public DetectionResult detect(LearningDataset dataset) {
        List<TouchSample> touches = dataset.getTouches();
        int total = touches.size();
        int converting = (int) touches.stream().filter(TouchSample::isBookingTouch).count();

        if (converting < MIN_CONVERTING || total < MIN_TOTAL) {
            log.info("[{}] WHEN: insufficient data ({} converting of {} touches)",
                    dataset.getTenantId(), converting, total);
            return DetectionResult.insufficient(WhenPatternPayload.defaults(), total);
        }

        double overallRate = ConversionStats.rate(converting, total);
        List<List<TouchSample>> convertedSequences = convertedSequences(dataset);

        Map<Integer, Integer> positions = touchPositions(touches);

        WhenPatternPayload payload = WhenPatternPayload.builder()
                .bestDays(bestDays(touches, overallRate))
                .bestHours(bestHours(touches, overallRate))
                .convertingTouchDistribution(touchDistribution(positions))
                .peakConvertingTouch(peakTouch(positions))
                .avgTouchesToConvert(averageTouch(positions))
                .optimalSequenceGaps(optimalGaps(convertedSequences))
                .conversionTiming(conversionTiming(convertedSequences))
                .build();

        log.info("[{}] WHEN: {} converting of {} touches, {} converted sequences",
                dataset.getTenantId(), converting, total, convertedSequences.size());
        return DetectionResult.of(payload, total, ConversionStats.confidence(converting));
    }

    List<RankedValue> bestDays(List<TouchSample> touches, double overallRate) {
        // Monday first, so ties keep calendar order
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            tallies.put(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), new Tally());
        }
        for (TouchSample touch : touches) {
            String day = touch.getSentAt().getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            tallies.get(day).add(touch.isBookingTouch());
        }
        return ConversionStats.rank(tallies, overallRate, MIN_BUCKET_SAMPLE, Integer.MAX_VALUE);
    }

    List<RankedValue> bestHours(List<TouchSample> touches, double overallRate) {
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (int hour = 0; hour < 24; hour++) {
            tallies.put(String.valueOf(hour), new Tally());
        }
        for (TouchSample touch : touches) {
            tallies.get(String.valueOf(touch.getSentAt().getHour())).add(touch.isBookingTouch());
        }
        return ConversionStats.rank(tallies, overallRate, MIN_BUCKET_SAMPLE, Integer.MAX_VALUE);
    }

    Map<Integer, Integer> touchPositions(List<TouchSample> touches) {
        Map<Integer, Integer> positions = new TreeMap<>();
        for (TouchSample touch : touches) {
            if (touch.isBookingTouch() && touch.getTouchNumber() != null) {
                positions.merge(touch.getTouchNumber(), 1, Integer::sum);
            }
        }
        return positions;
    }

    // share of the numbered booking touches, so the values sum to 1
    Map<String, Double> touchDistribution(Map<Integer, Integer> positions) {
        int numbered = 0;
        for (int count : positions.values()) {
            numbered += count;
        }
        Map<String, Double> distribution = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : positions.entrySet()) {
            distribution.put("touch_" + entry.getKey(), ConversionStats.rate(entry.getValue(), numbered));
        }
        return distribution;
    }

    // lowest touch number wins a tie
    private Integer peakTouch(Map<Integer, Integer> positions) {
        Integer peak = null;
        int peakCount = 0;
        for (Map.Entry<Integer, Integer> entry : positions.entrySet()) {
            if (entry.getValue() > peakCount) {
                peak = entry.getKey();
                peakCount = entry.getValue();
            }
        }
        return peak;
    }

    private double averageTouch(Map<Integer, Integer> positions) {
        long weighted = 0;
        int counted = 0;
        for (Map.Entry<Integer, Integer> entry : positions.entrySet()) {
            weighted += (long) entry.getKey() * entry.getValue();
            counted += entry.getValue();
        }
        return counted == 0 ? 0.0 : ConversionStats.round((double) weighted / counted, 2);
    }

    /**
     * Upper median of the whole-day gaps at each position, clamped to [1, 14]. Positions
     * without converted evidence keep the default spacing.
     */
    Map<String, Integer> optimalGaps(List<List<TouchSample>> sequences) {
        Map<Integer, List<Integer>> gapsByPosition = new TreeMap<>();
        for (List<TouchSample> sequence : sequences) {
            int pairs = Math.min(sequence.size() - 1, MAX_GAP_POSITIONS);
            for (int i = 0; i < pairs; i++) {
                gapsByPosition.computeIfAbsent(i + 1, p -> new ArrayList<>())
                        .add(gapDays(sequence.get(i), sequence.get(i + 1)));
            }
        }
        Map<String, Integer> gaps = WhenPatternPayload.defaultGaps();
        for (Map.Entry<Integer, List<Integer>> entry : gapsByPosition.entrySet()) {
            int position = entry.getKey();
            gaps.put("touch_" + position + "_to_" + (position + 1), ConversionStats.upperMedian(entry.getValue()));
        }
        return gaps;
    }

    private int gapDays(TouchSample from, TouchSample to) {
        long hours = Duration.between(from.getSentAt(), to.getSentAt()).toHours();
        int days = (int) Math.round(hours / 24.0);
        return Math.max(MIN_GAP_DAYS, Math.min(MAX_GAP_DAYS, days));
    }

    WhenPatternPayload.ConversionTiming conversionTiming(List<List<TouchSample>> sequences) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (List<TouchSample> sequence : sequences) {
            Duration span = Duration.between(sequence.get(0).getSentAt(), sequence.get(sequence.size() - 1).getSentAt());
            double days = span.getSeconds() / SECONDS_PER_DAY;
            stats.addValue(Math.max(0.0, Math.min(MAX_CONVERSION_DAYS, days)));
        }
        if (stats.getN() == 0) {
            return WhenPatternPayload.ConversionTiming.EMPTY;
        }
        return WhenPatternPayload.ConversionTiming.builder()
                .avg(ConversionStats.round(stats.getMean(), 2))
                .median(ConversionStats.round(stats.getPercentile(50), 2))
                .p50(ConversionStats.round(stats.getPercentile(50), 2))
                .p80(ConversionStats.round(stats.getPercentile(80), 2))
                .p95(ConversionStats.round(stats.getPercentile(95), 2))
                .sampleSize((int) stats.getN())
                .build();
    }

    private List<List<TouchSample>> convertedSequences(LearningDataset dataset) {
        Map<Long, LeadSample> leads = dataset.leadsById();
        List<List<TouchSample>> sequences = new ArrayList<>();
        for (Map.Entry<Long, List<TouchSample>> entry : dataset.sequencesByLead().entrySet()) {
            LeadSample lead = leads.get(entry.getKey());
            if (lead != null && lead.isConverted() && !entry.getValue().isEmpty()) {
                sequences.add(entry.getValue());
            }
        }
        return sequences;
    }
}
