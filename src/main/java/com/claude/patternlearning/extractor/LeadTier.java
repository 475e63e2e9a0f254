package com.claude.patternlearning.extractor;

/**
 * Coarse score buckets used to segment channel analysis.
 */
public enum LeadTier {
    HOT(85),
    WARM(60),
    COOL(35),
    COLD(0);

    private final int minScore;

    LeadTier(int minScore) {
        this.minScore = minScore;
    }

    public static LeadTier fromScore(Integer score) {
        if (score == null) {
            return null;
        }
        for (LeadTier tier : values()) {
            if (score >= tier.minScore) {
                return tier;
            }
        }
        return COLD;
    }
}
