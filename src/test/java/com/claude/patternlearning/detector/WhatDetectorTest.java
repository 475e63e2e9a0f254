package com.claude.patternlearning.detector;

import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.entity.Channel;
import com.claude.patternlearning.extractor.ContentFeatureExtractor;
import com.claude.patternlearning.extractor.ContentSnapshot;
import com.claude.patternlearning.pattern.FeatureLift;
import com.claude.patternlearning.pattern.PatternJsonCodec;
import com.claude.patternlearning.pattern.WhatPatternPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.claude.patternlearning.detector.DatasetFixtures.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("WhatDetector")
class WhatDetectorTest {

    private static final LocalDateTime SENT = LocalDateTime.of(2026, 2, 10, 9, 0);

    private final PatternJsonCodec codec = new PatternJsonCodec();
    private PatternLearningProperties properties;
    private WhatDetector detector;

    @BeforeEach
    void setUp() {
        properties = new PatternLearningProperties();
        detector = new WhatDetector(codec, new ContentFeatureExtractor(), properties);
    }

    private String winningSnapshot() {
        return codec.encode(ContentSnapshot.builder()
                .channel("email")
                .subject("Quick question about Acme")
                .painPoints(List.of("leads"))
                .cta("quick call")
                .angles(List.of("curiosity"))
                .hasFirstName(true)
                .wordCount(60)
                .charCount(360)
                .touchNumber(2)
                .build());
    }

    private String losingSnapshot() {
        return codec.encode(ContentSnapshot.builder()
                .channel("email")
                .subject("Partnership")
                .painPoints(List.of("cost"))
                .cta("let me know")
                .angles(List.of("value_add"))
                .wordCount(120)
                .charCount(700)
                .touchNumber(1)
                .build());
    }

    private LearningDataset mixedDataset(int converting, int others) {
        DatasetFixtures fixtures = dataset();
        long lead = 1;
        for (int i = 0; i < converting; i++) {
            fixtures.touch(lead++, Channel.EMAIL, SENT, 2, true, winningSnapshot());
        }
        for (int i = 0; i < others; i++) {
            fixtures.touch(lead++, Channel.EMAIL, SENT, 1, false, losingSnapshot());
        }
        fixtures.touch(lead++, Channel.EMAIL, SENT, 1, false, "{not json");
        fixtures.touch(lead++, Channel.EMAIL, SENT, 1, false, "[]");
        fixtures.touch(lead++, Channel.EMAIL, SENT, 1, false, "");
        fixtures.touch(lead, Channel.EMAIL, SENT, 1, false, null);
        return fixtures.build();
    }

    @Test
    @DisplayName("skips unreadable snapshots and counts them")
    void countsMalformedSnapshots() {
        DetectionResult result = detector.detect(mixedDataset(6, 24));

        WhatPatternPayload payload = (WhatPatternPayload) result.getPayload();
        assertThat(result.isSufficientData()).isTrue();
        assertThat(result.getSampleSize()).isEqualTo(30);
        assertThat(payload.getMalformedSnapshotsSkipped()).isEqualTo(4);
        assertThat(payload.getConvertingTouches()).isEqualTo(6);
        assertThat(payload.getTotalTouches()).isEqualTo(30);
        assertThat(result.getConfidence()).isCloseTo(ConversionStats.confidence(6), within(1e-12));
    }

    @Test
    @DisplayName("separates features that over-index on bookings from those that under-index")
    void featureLifts() {
        WhatPatternPayload payload = (WhatPatternPayload) detector.detect(mixedDataset(6, 24)).getPayload();

        assertThat(payload.getSubjectPatterns().getWinning())
                .extracting(FeatureLift::getFeature)
                .containsExactly("question_about", "quick_question");
        assertThat(payload.getSubjectPatterns().getLosing()).isEmpty();

        FeatureLift leads = payload.getPainPoints().getEffective().get(0);
        assertThat(leads.getFeature()).isEqualTo("leads");
        assertThat(leads.getFrequency()).isEqualTo(1.0);
        assertThat(leads.getLift()).isCloseTo(5.0, within(1e-9));
        assertThat(payload.getPainPoints().getIneffective())
                .extracting(FeatureLift::getFeature)
                .containsExactly("cost");

        assertThat(payload.getCtas().getEffective())
                .extracting(FeatureLift::getFeature)
                .containsExactly("quick call");
        assertThat(payload.getAngles().getRankings())
                .extracting(FeatureLift::getFeature)
                .containsExactly("curiosity", "value_add");
    }

    @Test
    @DisplayName("derives a length band from converting touches per channel")
    void lengthBand() {
        WhatPatternPayload payload = (WhatPatternPayload) detector.detect(mixedDataset(6, 24)).getPayload();

        WhatPatternPayload.LengthBand email = payload.getOptimalLength().get("email");
        assertThat(email.getTargetWords()).isEqualTo(60);
        assertThat(email.getMinWords()).isEqualTo(35);
        assertThat(email.getMaxWords()).isEqualTo(85);
        assertThat(email.getMedianChars()).isEqualTo(360);
        assertThat(email.getSampleSize()).isEqualTo(6);
    }

    @Test
    @DisplayName("reports neutral personalization lift for flags without evidence")
    void personalizationLift() {
        WhatPatternPayload payload = (WhatPatternPayload) detector.detect(mixedDataset(6, 24)).getPayload();

        assertThat(payload.getPersonalizationLift())
                .containsEntry(ContentFeatureExtractor.HAS_RECENT_NEWS, 1.0)
                .containsEntry(ContentFeatureExtractor.HAS_COMPANY_MENTION, 1.0);
        assertThat(payload.getPersonalizationLift().get(ContentFeatureExtractor.HAS_FIRST_NAME))
                .isCloseTo(5.0, within(1e-9));
    }

    @Test
    @DisplayName("returns defaults with fewer than five converting touches")
    void defaultsBelowFloor() {
        DetectionResult result = detector.detect(mixedDataset(4, 40));

        WhatPatternPayload payload = (WhatPatternPayload) result.getPayload();
        assertThat(result.isSufficientData()).isFalse();
        assertThat(payload.getMalformedSnapshotsSkipped()).isEqualTo(4);
        assertThat(payload.getPainPoints().getEffective()).isEmpty();
        assertThat(payload.getOptimalLength()).isEmpty();
    }

    @Test
    @DisplayName("samples non-booking touches by lowest id up to the cap")
    void samplesNonBookingTouches() {
        properties.getDetection().setNonConvertingSampleFloor(10);
        properties.getDetection().setNonConvertingSampleMultiplier(2);
        List<TouchSample> touches = new ArrayList<>();
        for (long id = 40; id >= 1; id--) {
            touches.add(TouchSample.builder().id(id).leadId(id).channel(Channel.SMS).sentAt(SENT).build());
        }
        for (long id = 100; id < 106; id++) {
            touches.add(TouchSample.builder().id(id).leadId(id).channel(Channel.SMS).sentAt(SENT)
                    .bookingTouch(true).build());
        }

        List<TouchSample> selected = detector.selectTouches(touches);

        assertThat(selected).hasSize(18);
        assertThat(selected).filteredOn(t -> !t.isBookingTouch())
                .extracting(TouchSample::getId)
                .containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L);
    }
}
