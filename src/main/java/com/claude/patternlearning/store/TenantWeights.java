package com.claude.patternlearning.store;

import com.claude.patternlearning.pattern.ScoringWeights;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Weights a scorer should use for a tenant: the learned vector while it is valid,
 * the defaults otherwise.
 */
@Value
public class TenantWeights {
    String tenantId;
    ScoringWeights weights;
    boolean learned;
    Integer sampleCount;
    LocalDateTime validUntil;

    public static TenantWeights defaults(String tenantId) {
        return new TenantWeights(tenantId, ScoringWeights.DEFAULT, false, null, null);
    }

    boolean isStaleAt(LocalDateTime now) {
        return learned && validUntil != null && !validUntil.isAfter(now);
    }
}
