package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.Channel;
import com.claude.patternlearning.pattern.ChannelStat;
import com.claude.patternlearning.pattern.HowPatternPayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.claude.patternlearning.detector.DatasetFixtures.dataset;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HowDetector")
class HowDetectorTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 2, 2, 10, 0);

    private final HowDetector detector = new HowDetector();

    private LearningDataset emailLinkedinVoiceWins() {
        DatasetFixtures fixtures = dataset();
        for (int i = 0; i < 5; i++) {
            fixtures.journey(true, START, Channel.EMAIL, Channel.LINKEDIN, Channel.VOICE);
        }
        for (int i = 0; i < 15; i++) {
            fixtures.journey(false, START, Channel.EMAIL, Channel.SMS);
        }
        return fixtures.build();
    }

    @Nested
    @DisplayName("with enough journeys")
    class Sufficient {

        @Test
        @DisplayName("puts the sequence that always converted on top")
        void winningSequenceFirst() {
            DetectionResult result = detector.detect(emailLinkedinVoiceWins());

            assertThat(result.isSufficientData()).isTrue();
            assertThat(result.getSampleSize()).isEqualTo(20);

            HowPatternPayload payload = (HowPatternPayload) result.getPayload();
            List<HowPatternPayload.SequenceStat> sequences = payload.getWinningSequences();
            assertThat(sequences).hasSize(2);
            assertThat(sequences.get(0).getSequence()).containsExactly("email", "linkedin", "voice");
            assertThat(sequences.get(0).getConversionRate()).isEqualTo(1.0);
            assertThat(sequences.get(0).getSampleSize()).isEqualTo(5);
            assertThat(sequences.get(1).getSequence()).containsExactly("email", "sms", "none");
        }

        @Test
        @DisplayName("attributes bookings to the channel of the booking touch")
        void bookingDistribution() {
            HowPatternPayload payload = (HowPatternPayload) detector.detect(emailLinkedinVoiceWins()).getPayload();

            assertThat(payload.getBookingChannelDistribution()).containsExactly(Map.entry("voice", 1.0));
            assertThat(payload.getBestFirstChannel()).isEqualTo("email");
            assertThat(payload.getFirstTouchEffectiveness().get("email").getConversionRate()).isEqualTo(0.25);
        }

        @Test
        @DisplayName("compares channel counts against single-channel journeys")
        void multiChannelLift() {
            HowPatternPayload payload = (HowPatternPayload) detector.detect(emailLinkedinVoiceWins()).getPayload();

            Map<String, ChannelStat> lift = payload.getMultiChannelLift();
            assertThat(lift).containsOnlyKeys("2", "3");
            assertThat(lift.get("3").getConversionRate()).isEqualTo(1.0);
            // no single-channel journeys, so no baseline
            assertThat(lift.get("3").getLift()).isEqualTo(1.0);
            assertThat(payload.getOptimalChannelCount()).isEqualTo("3");
        }

        @Test
        @DisplayName("builds the transition matrix from converted sequences only")
        void transitions() {
            HowPatternPayload payload = (HowPatternPayload) detector.detect(emailLinkedinVoiceWins()).getPayload();

            assertThat(payload.getChannelTransitions()).containsOnlyKeys("email", "linkedin");
            assertThat(payload.getChannelTransitions().get("email")).containsExactly(Map.entry("linkedin", 1.0));
            assertThat(payload.getChannelTransitions().get("linkedin")).containsExactly(Map.entry("voice", 1.0));
        }
    }

    @Test
    @DisplayName("returns defaults with fewer than five converted journeys")
    void returnsDefaultsBelowFloor() {
        DatasetFixtures fixtures = dataset();
        for (int i = 0; i < 4; i++) {
            fixtures.journey(true, START, Channel.EMAIL, Channel.VOICE);
        }
        for (int i = 0; i < 30; i++) {
            fixtures.journey(false, START, Channel.EMAIL);
        }

        DetectionResult result = detector.detect(fixtures.build());

        assertThat(result.isSufficientData()).isFalse();
        assertThat(((HowPatternPayload) result.getPayload()).getWinningSequences()).isEmpty();
    }

    @Test
    @DisplayName("breaks sequence ties by sample size, then by slot names")
    void sequenceTieBreak() {
        List<HowDetector.Journey> journeys = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            journeys.add(new HowDetector.Journey(List.of(Channel.SMS), true, Channel.SMS, null));
            journeys.add(new HowDetector.Journey(List.of(Channel.EMAIL), true, Channel.EMAIL, null));
        }
        for (int i = 0; i < 6; i++) {
            journeys.add(new HowDetector.Journey(List.of(Channel.VOICE), true, Channel.VOICE, null));
        }

        List<HowPatternPayload.SequenceStat> ranked = detector.winningSequences(journeys);

        assertThat(ranked).extracting(s -> String.join(">", s.getSequence()))
                .containsExactly("voice>none>none", "email>none>none", "sms>none>none");
    }
}
