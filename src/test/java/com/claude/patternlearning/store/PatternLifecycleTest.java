package com.claude.patternlearning.store;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class PatternLifecycleTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 6, 0);

    @Test
    void classifiesByValidUntil() {
        assertThat(PatternLifecycle.of(null, NOW, 3)).isEqualTo(PatternLifecycle.ABSENT);
        assertThat(PatternLifecycle.of(NOW, NOW, 3)).isEqualTo(PatternLifecycle.EXPIRED);
        assertThat(PatternLifecycle.of(NOW.plusDays(3), NOW, 3)).isEqualTo(PatternLifecycle.EXPIRING_SOON);
        assertThat(PatternLifecycle.of(NOW.plusDays(3).plusMinutes(1), NOW, 3)).isEqualTo(PatternLifecycle.VALID);
    }

    @Test
    void onlyLivePatternsAreUsable() {
        assertThat(PatternLifecycle.VALID.isUsable()).isTrue();
        assertThat(PatternLifecycle.EXPIRING_SOON.isUsable()).isTrue();
        assertThat(PatternLifecycle.EXPIRED.isUsable()).isFalse();
        assertThat(PatternLifecycle.ABSENT.isUsable()).isFalse();
    }
}
