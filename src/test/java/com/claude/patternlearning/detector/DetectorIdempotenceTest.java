package com.claude.patternlearning.detector;

import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.entity.Channel;
import com.claude.patternlearning.extractor.ContentFeatureExtractor;
import com.claude.patternlearning.extractor.ContentSnapshot;
import com.claude.patternlearning.extractor.TitleNormalizer;
import com.claude.patternlearning.optimizer.WeightOptimizer;
import com.claude.patternlearning.pattern.PatternJsonCodec;
import com.claude.patternlearning.pattern.ScoreComponent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static com.claude.patternlearning.detector.DatasetFixtures.dataset;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Detection over an unchanged dataset must encode to the same bytes every time. The fixture
 * is built so that titles, channel sequences and days tie on rate and sample size.
 */
@DisplayName("Detector idempotence")
class DetectorIdempotenceTest {

    private static final PatternJsonCodec CODEC = new PatternJsonCodec();
    private static final LocalDateTime START = LocalDateTime.of(2026, 2, 2, 9, 0);

    static Stream<PatternDetector> detectors() {
        return Stream.of(
                new WhoDetector(new WeightOptimizer(), new TitleNormalizer()),
                new WhatDetector(CODEC, new ContentFeatureExtractor(), new PatternLearningProperties()),
                new WhenDetector(),
                new HowDetector());
    }

    private static String snapshot(boolean booking, int touchNumber) {
        return CODEC.encode(ContentSnapshot.builder()
                .channel("email")
                .subject(booking ? "Quick question about Acme" : "Partnership")
                .painPoints(List.of(booking ? "leads" : "cost"))
                .cta(booking ? "quick call" : "let me know")
                .angles(List.of(booking ? "curiosity" : "value_add"))
                .hasFirstName(booking)
                .wordCount(booking ? 60 : 120)
                .charCount(booking ? 360 : 700)
                .touchNumber(touchNumber)
                .build());
    }

    private static Map<String, Double> components(int i) {
        Map<String, Double> components = new TreeMap<>();
        components.put(ScoreComponent.DATA_QUALITY.getKey(), (double) (10 + i % 7));
        components.put(ScoreComponent.AUTHORITY.getKey(), i % 2 == 0 ? 25.0 : 15.0);
        components.put(ScoreComponent.COMPANY_FIT.getKey(), 20.0);
        components.put(ScoreComponent.TIMING.getKey(), i % 4 < 2 ? 10.0 : 5.0);
        return components;
    }

    /**
     * 80 leads, half converted. Even and odd leads convert at the same rate, so the two titles
     * and industries tie; converted leads alternate between two two-step channel sequences
     * that tie on rate and sample.
     */
    private static LearningDataset tiedDataset() {
        DatasetFixtures fixtures = dataset();
        for (int i = 0; i < 80; i++) {
            boolean converted = i % 4 < 2;
            long lead = fixtures.lead(LeadSample.builder()
                    .title(i % 2 == 0 ? "CEO" : "Head of Sales")
                    .industry(i % 2 == 0 ? "Software" : "Retail")
                    .employeeCount(20)
                    .newRole(i % 5 == 0)
                    .converted(converted)
                    .scoreComponents(components(i)));
            Channel[] channels;
            if (!converted) {
                channels = new Channel[]{Channel.EMAIL, Channel.SMS};
            } else if (i % 4 == 0) {
                channels = new Channel[]{Channel.EMAIL, Channel.LINKEDIN};
            } else {
                channels = new Channel[]{Channel.SMS, Channel.VOICE};
            }
            LocalDateTime sent = START.plusDays(i % 7).plusHours(i % 3);
            for (int t = 0; t < channels.length; t++) {
                boolean booking = converted && t == channels.length - 1;
                fixtures.touch(lead, channels[t], sent.plusDays(2L * t), t + 1, booking, snapshot(booking, t + 1));
            }
        }
        return fixtures.build();
    }

    @ParameterizedTest
    @MethodSource("detectors")
    @DisplayName("encodes identical payloads on repeated runs over the same dataset")
    void repeatedRunsEncodeIdentically(PatternDetector detector) {
        LearningDataset data = tiedDataset();

        DetectionResult first = detector.detect(data);
        DetectionResult second = detector.detect(data);
        DetectionResult rebuilt = detector.detect(tiedDataset());

        assertThat(first.isSufficientData()).isTrue();
        String encoded = CODEC.encode(first.getPayload());
        assertThat(CODEC.encode(second.getPayload())).isEqualTo(encoded);
        assertThat(CODEC.encode(rebuilt.getPayload())).isEqualTo(encoded);
        assertThat(second.getConfidence()).isEqualTo(first.getConfidence());
        assertThat(second.getSampleSize()).isEqualTo(first.getSampleSize());
    }
}
