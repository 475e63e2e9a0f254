package com.claude.patternlearning.extractor;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TitleNormalizerTest {

    private final TitleNormalizer normalizer = new TitleNormalizer();

    @ParameterizedTest
    @CsvSource({
            "Chief Executive Officer, CEO",
            "CEO & Founder, CEO",
            "Co-Founder, Owner",
            "Director of Marketing, Marketing Director",
            "  vp   of sales , Vp Of Sales",
            "operations manager, Operations Manager"
    })
    void collapsesTitlesIntoGroups(String title, String expected) {
        assertThat(normalizer.normalize(title)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void blankTitlesHaveNoGroup(String title) {
        assertThat(normalizer.normalize(title)).isNull();
    }
}
