package com.claude.patternlearning.extractor;

/**
 * Company-size buckets by employee count.
 */
public enum SizeBucket {
    MICRO("1-5", 1, 5),
    SMALL("6-15", 6, 15),
    GROWING("16-30", 16, 30),
    ESTABLISHED("31-50", 31, 50),
    MID("51-100", 51, 100),
    UPPER_MID("101-250", 101, 250),
    LARGE("251-500", 251, 500),
    ENTERPRISE("501+", 501, Integer.MAX_VALUE);

    private final String label;
    private final int min;
    private final int max;

    SizeBucket(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String getLabel() {
        return label;
    }

    public static String labelOf(Integer employeeCount) {
        if (employeeCount == null || employeeCount < 1) {
            return null;
        }
        for (SizeBucket bucket : values()) {
            if (employeeCount >= bucket.min && employeeCount <= bucket.max) {
                return bucket.label;
            }
        }
        return null;
    }
}
