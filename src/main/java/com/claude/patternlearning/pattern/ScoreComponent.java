package com.claude.patternlearning.pattern;

/**
 * Named sub-scores of the lead score, in weight-vector order, with their maximum points.
 */
public enum ScoreComponent {
    DATA_QUALITY("data_quality", 20),
    AUTHORITY("authority", 25),
    COMPANY_FIT("company_fit", 25),
    TIMING("timing", 15);

    private final String key;
    private final int maxPoints;

    ScoreComponent(String key, int maxPoints) {
        this.key = key;
        this.maxPoints = maxPoints;
    }

    public String getKey() {
        return key;
    }

    public int getMaxPoints() {
        return maxPoints;
    }
}
