package com.claude.patternlearning.detector;

import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.exception.MalformedContentException;
import com.claude.patternlearning.extractor.ContentFeatureExtractor;
import com.claude.patternlearning.extractor.ContentSnapshot;
import com.claude.patternlearning.pattern.FeatureLift;
import com.claude.patternlearning.pattern.PatternJsonCodec;
import com.claude.patternlearning.pattern.WhatPatternPayload;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * WHAT detector - which content converts.
 *
 * <p>Compares the content snapshots of booking touches against a deterministic sample of
 * other touches. Touches whose snapshot is missing or unreadable are skipped and counted.
 */
@Component
@Slf4j
public class WhatDetector implements PatternDetector {

    static final int MIN_CONVERTING = 5;
    static final int MIN_TOTAL = 20;
    static final int MIN_FEATURE_SAMPLE = 5;
    static final int TOP_EFFECTIVE = 5;
    static final int TOP_INEFFECTIVE = 3;
    static final int LENGTH_TOLERANCE_WORDS = 25;
    static final int MIN_TARGET_WORDS = 10;

    private static final Comparator<FeatureLift> BY_LIFT_DESC = Comparator
            .comparingDouble(FeatureLift::getLift).reversed()
            .thenComparing(Comparator.comparingInt(FeatureLift::getSampleSize).reversed());

    private static final Comparator<FeatureLift> BY_LIFT_ASC = Comparator
            .comparingDouble(FeatureLift::getLift)
            .thenComparing(Comparator.comparingInt(FeatureLift::getSampleSize).reversed());

    private static final Comparator<FeatureLift> BY_RATE_DESC = Comparator
            .comparingDouble(FeatureLift::getConversionRate).reversed()
            .thenComparing(Comparator.comparingInt(FeatureLift::getSampleSize).reversed());

    private final PatternJsonCodec codec;
    private final ContentFeatureExtractor extractor;
    private final PatternLearningProperties properties;

    public WhatDetector(PatternJsonCodec codec,
                        ContentFeatureExtractor extractor,
                        PatternLearningProperties properties) {
        this.codec = codec;
        this.extractor = extractor;
        this.properties = properties;
    }

    @Override
    public PatternType getPatternType() {
        return PatternType.WHAT;
    }

    @Override
    public DetectionResult detect(LearningDataset dataset) {
        List<TouchSample> selected = selectTouches(dataset.getTouches());

        List<ParsedTouch> parsed = new ArrayList<>();
        int malformed = 0;
        for (TouchSample touch : selected) {
            try {
                parsed.add(new ParsedTouch(touch, codec.parseSnapshot(touch.getContentSnapshot())));
            } catch (MalformedContentException e) {
                malformed++;
                log.debug("[{}] WHAT: skipping touch {}: {}", dataset.getTenantId(), touch.getId(), e.getMessage());
            }
        }
        if (malformed > 0) {
            log.warn("[{}] WHAT: skipped {} touches with missing or malformed content snapshots",
                    dataset.getTenantId(), malformed);
        }

        int total = parsed.size();
        int converting = (int) parsed.stream().filter(ParsedTouch::isConverting).count();
        if (converting < MIN_CONVERTING || total < MIN_TOTAL) {
            log.info("[{}] WHAT: insufficient data ({} converting of {} touches)",
                    dataset.getTenantId(), converting, total);
            return DetectionResult.insufficient(WhatPatternPayload.defaults(converting, total, malformed), total);
        }

        double overallRate = ConversionStats.rate(converting, total);

        List<FeatureLift> subjects = featureLifts(parsed, converting, overallRate,
                t -> extractor.detectSubjectPatterns(t.snapshot.getSubject()));
        List<FeatureLift> painPoints = featureLifts(parsed, converting, overallRate,
                t -> nullSafe(t.snapshot.getPainPoints()));
        List<FeatureLift> ctas = featureLifts(parsed, converting, overallRate,
                t -> t.snapshot.getCta() != null ? List.of(t.snapshot.getCta()) : List.of());
        List<FeatureLift> angles = featureLifts(parsed, converting, overallRate,
                t -> nullSafe(t.snapshot.getAngles()));

        WhatPatternPayload payload = WhatPatternPayload.builder()
                .subjectPatterns(WhatPatternPayload.SubjectPatterns.builder()
                        .winning(filterSort(subjects, l -> l.getLift() > 1.0, BY_LIFT_DESC, Integer.MAX_VALUE))
                        .losing(filterSort(subjects, l -> l.getLift() < 1.0, BY_LIFT_ASC, Integer.MAX_VALUE))
                        .build())
                .painPoints(WhatPatternPayload.PainPoints.builder()
                        .effective(filterSort(painPoints, l -> l.getLift() > 1.0, BY_LIFT_DESC, TOP_EFFECTIVE))
                        .ineffective(filterSort(painPoints, l -> l.getLift() < 1.0, BY_LIFT_ASC, TOP_INEFFECTIVE))
                        .build())
                .ctas(WhatPatternPayload.Ctas.builder()
                        .effective(filterSort(ctas, l -> l.getLift() > 1.0, BY_LIFT_DESC, TOP_EFFECTIVE))
                        .build())
                .angles(WhatPatternPayload.Angles.builder()
                        .rankings(filterSort(angles, l -> true, BY_RATE_DESC, Integer.MAX_VALUE))
                        .build())
                .optimalLength(optimalLength(parsed))
                .personalizationLift(personalizationLift(parsed, overallRate))
                .convertingTouches(converting)
                .totalTouches(total)
                .malformedSnapshotsSkipped(malformed)
                .build();

        log.info("[{}] WHAT: {} converting of {} touches analysed", dataset.getTenantId(), converting, total);
        return DetectionResult.of(payload, total, ConversionStats.confidence(converting));
    }

    /**
     * Every booking touch plus the lowest-id non-booking touches, capped relative to the
     * number of booking touches.
     */
    List<TouchSample> selectTouches(List<TouchSample> touches) {
        List<TouchSample> converting = new ArrayList<>();
        List<TouchSample> others = new ArrayList<>();
        for (TouchSample touch : touches) {
            (touch.isBookingTouch() ? converting : others).add(touch);
        }
        others.sort(Comparator.comparing(TouchSample::getId));
        PatternLearningProperties.Detection detection = properties.getDetection();
        int cap = Math.max(detection.getNonConvertingSampleFloor(),
                detection.getNonConvertingSampleMultiplier() * converting.size());
        List<TouchSample> selected = new ArrayList<>(converting);
        selected.addAll(others.size() > cap ? others.subList(0, cap) : others);
        return selected;
    }

    private List<FeatureLift> featureLifts(List<ParsedTouch> touches, int converting, double overallRate,
                                           Function<ParsedTouch, List<String>> features) {
        Map<String, Tally> tallies = new TreeMap<>();
        for (ParsedTouch touch : touches) {
            for (String feature : features.apply(touch)) {
                tallies.computeIfAbsent(feature.toLowerCase(Locale.ROOT), f -> new Tally()).add(touch.isConverting());
            }
        }
        List<FeatureLift> lifts = new ArrayList<>();
        for (Map.Entry<String, Tally> entry : tallies.entrySet()) {
            Tally tally = entry.getValue();
            if (tally.getTotal() < MIN_FEATURE_SAMPLE) {
                continue;
            }
            lifts.add(FeatureLift.builder()
                    .feature(entry.getKey())
                    .frequency(ConversionStats.rate(tally.getConversions(), converting))
                    .conversionRate(tally.rate())
                    .lift(ConversionStats.lift(tally.rate(), overallRate))
                    .sampleSize(tally.getTotal())
                    .build());
        }
        return lifts;
    }

    private List<FeatureLift> filterSort(List<FeatureLift> lifts, Predicate<FeatureLift> filter,
                                         Comparator<FeatureLift> order, int limit) {
        List<FeatureLift> result = new ArrayList<>();
        for (FeatureLift lift : lifts) {
            if (filter.test(lift)) {
                result.add(lift);
            }
        }
        result.sort(order);
        return result.size() > limit ? new ArrayList<>(result.subList(0, limit)) : result;
    }

    private Map<String, WhatPatternPayload.LengthBand> optimalLength(List<ParsedTouch> touches) {
        Map<String, DescriptiveStatistics> words = new TreeMap<>();
        Map<String, DescriptiveStatistics> chars = new TreeMap<>();
        for (ParsedTouch touch : touches) {
            if (!touch.isConverting()) {
                continue;
            }
            String channel = touch.channel();
            words.computeIfAbsent(channel, c -> new DescriptiveStatistics()).addValue(touch.snapshot.getWordCount());
            chars.computeIfAbsent(channel, c -> new DescriptiveStatistics()).addValue(touch.snapshot.getCharCount());
        }
        Map<String, WhatPatternPayload.LengthBand> bands = new TreeMap<>();
        for (Map.Entry<String, DescriptiveStatistics> entry : words.entrySet()) {
            DescriptiveStatistics stats = entry.getValue();
            if (stats.getN() < MIN_FEATURE_SAMPLE) {
                continue;
            }
            int target = (int) Math.round(stats.getPercentile(50));
            bands.put(entry.getKey(), WhatPatternPayload.LengthBand.builder()
                    .targetWords(target)
                    .minWords(Math.max(MIN_TARGET_WORDS, target - LENGTH_TOLERANCE_WORDS))
                    .maxWords(target + LENGTH_TOLERANCE_WORDS)
                    .medianChars((int) Math.round(chars.get(entry.getKey()).getPercentile(50)))
                    .sampleSize((int) stats.getN())
                    .build());
        }
        return bands;
    }

    private Map<String, Double> personalizationLift(List<ParsedTouch> touches, double overallRate) {
        Map<String, Tally> tallies = new TreeMap<>();
        tallies.put(ContentFeatureExtractor.HAS_COMPANY_MENTION, new Tally());
        tallies.put(ContentFeatureExtractor.HAS_FIRST_NAME, new Tally());
        tallies.put(ContentFeatureExtractor.HAS_RECENT_NEWS, new Tally());
        tallies.put(ContentFeatureExtractor.HAS_MUTUAL_CONNECTION, new Tally());
        tallies.put(ContentFeatureExtractor.HAS_INDUSTRY_SPECIFIC, new Tally());
        for (ParsedTouch touch : touches) {
            ContentSnapshot s = touch.snapshot;
            addIf(tallies.get(ContentFeatureExtractor.HAS_COMPANY_MENTION), s.isHasCompanyMention(), touch);
            addIf(tallies.get(ContentFeatureExtractor.HAS_FIRST_NAME), s.isHasFirstName(), touch);
            addIf(tallies.get(ContentFeatureExtractor.HAS_RECENT_NEWS), s.isHasRecentNews(), touch);
            addIf(tallies.get(ContentFeatureExtractor.HAS_MUTUAL_CONNECTION), s.isHasMutualConnection(), touch);
            addIf(tallies.get(ContentFeatureExtractor.HAS_INDUSTRY_SPECIFIC), s.isHasIndustrySpecific(), touch);
        }
        Map<String, Double> lifts = new TreeMap<>();
        for (Map.Entry<String, Tally> entry : tallies.entrySet()) {
            Tally tally = entry.getValue();
            lifts.put(entry.getKey(), tally.getTotal() < MIN_FEATURE_SAMPLE
                    ? 1.0
                    : ConversionStats.lift(tally.rate(), overallRate));
        }
        return lifts;
    }

    private void addIf(Tally tally, boolean flag, ParsedTouch touch) {
        if (flag) {
            tally.add(touch.isConverting());
        }
    }

    private static List<String> nullSafe(List<String> values) {
        return values != null ? values : List.of();
    }

    private static final class ParsedTouch {
        private final TouchSample touch;
        private final ContentSnapshot snapshot;

        ParsedTouch(TouchSample touch, ContentSnapshot snapshot) {
            this.touch = touch;
            this.snapshot = snapshot;
        }

        boolean isConverting() {
            return touch.isBookingTouch();
        }

        String channel() {
            if (touch.getChannel() != null) {
                return touch.getChannel().getCode();
            }
            return snapshot.getChannel() != null ? snapshot.getChannel().toLowerCase(Locale.ROOT) : "unknown";
        }
    }
}
