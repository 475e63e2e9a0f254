package com.claude.patternlearning.extractor;

import com.claude.patternlearning.entity.Channel;
import com.claude.patternlearning.entity.Lead;
import com.claude.patternlearning.entity.Touch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContentFeatureExtractor")
class ContentFeatureExtractorTest {

    private final ContentFeatureExtractor extractor = new ContentFeatureExtractor();

    @Test
    @DisplayName("lists each pain-point category once in vocabulary order")
    void painPoints() {
        assertThat(extractor.detectPainPoints("Cut cost and fill your pipeline. More pipeline, less cost."))
                .containsExactly("leads", "cost");
        assertThat(extractor.detectPainPoints(null)).isEmpty();
    }

    @Test
    @DisplayName("picks the first call to action in phrase order")
    void cta() {
        assertThat(extractor.detectCta("Let me know if a quick call next week works")).isEqualTo("quick call");
        assertThat(extractor.detectCta("Regards, Sam")).isNull();
    }

    @Test
    @DisplayName("matches subject patterns on the trimmed lowercase subject")
    void subjectPatterns() {
        assertThat(extractor.detectSubjectPatterns("  Re: quick question for Sam"))
                .containsExactly("question_about", "reply_style");
        assertThat(extractor.detectSubjectPatterns("Quick question")).containsExactly("quick_question");
        assertThat(extractor.detectSubjectPatterns("")).isEmpty();
    }

    @Test
    @DisplayName("flags personalization against the lead's own attributes")
    void personalization() {
        Map<String, Boolean> flags = extractor.detectPersonalization(
                "Hi Sam, congrats on the Series A at Acme", "Sam", "Acme", "fintech");

        assertThat(flags)
                .containsEntry(ContentFeatureExtractor.HAS_FIRST_NAME, true)
                .containsEntry(ContentFeatureExtractor.HAS_COMPANY_MENTION, true)
                .containsEntry(ContentFeatureExtractor.HAS_RECENT_NEWS, true)
                .containsEntry(ContentFeatureExtractor.HAS_MUTUAL_CONNECTION, false)
                .containsEntry(ContentFeatureExtractor.HAS_INDUSTRY_SPECIFIC, false);
    }

    @Test
    @DisplayName("counts whitespace-separated words")
    void wordCount() {
        assertThat(extractor.wordCount("  one two\nthree  ")).isEqualTo(3);
        assertThat(extractor.wordCount(null)).isZero();
    }

    @Test
    @DisplayName("builds the same snapshot from the same touch")
    void extractSnapshot() {
        Touch touch = new Touch();
        touch.setChannel(Channel.EMAIL);
        touch.setSentAt(LocalDateTime.of(2026, 1, 6, 9, 30));
        touch.setTouchNumber(2);
        touch.setSequenceId("seq-1");
        touch.setSubject("Idea for Acme");
        touch.setBody("Hi Sam, noticed Acme is hiring. Worth 15 minutes?");
        Lead lead = new Lead();
        lead.setFirstName("Sam");
        lead.setCompanyName("Acme");

        ContentSnapshot snapshot = extractor.extract(touch, lead);

        assertThat(snapshot.getChannel()).isEqualTo("email");
        assertThat(snapshot.getCta()).isEqualTo("worth 15 minutes");
        assertThat(snapshot.getAngles()).containsExactly("curiosity");
        assertThat(snapshot.isHasFirstName()).isTrue();
        assertThat(snapshot.isHasCompanyMention()).isTrue();
        assertThat(snapshot.isHasRecentNews()).isTrue();
        assertThat(snapshot.getWordCount()).isEqualTo(9);
        assertThat(snapshot.getCharCount()).isEqualTo(touch.getBody().length());
        assertThat(snapshot.getTouchNumber()).isEqualTo(2);
        assertThat(snapshot.getSequenceId()).isEqualTo("seq-1");
        assertThat(extractor.extract(touch, lead)).isEqualTo(snapshot);
    }
}
