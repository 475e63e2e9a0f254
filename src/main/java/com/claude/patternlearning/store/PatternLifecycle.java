package com.claude.patternlearning.store;

import java.time.LocalDateTime;

/**
 * Freshness of a tenant's current pattern, derived from its valid-until timestamp.
 */
public enum PatternLifecycle {
    ABSENT,
    VALID,
    EXPIRING_SOON,
    EXPIRED;

    public static PatternLifecycle of(LocalDateTime validUntil, LocalDateTime now, int expiringWindowDays) {
        if (validUntil == null) {
            return ABSENT;
        }
        if (!validUntil.isAfter(now)) {
            return EXPIRED;
        }
        if (!validUntil.isAfter(now.plusDays(expiringWindowDays))) {
            return EXPIRING_SOON;
        }
        return VALID;
    }

    public boolean isUsable() {
        return this == VALID || this == EXPIRING_SOON;
    }
}
