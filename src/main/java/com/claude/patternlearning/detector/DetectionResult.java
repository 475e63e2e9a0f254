package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.pattern.PatternPayload;
import lombok.Value;

/**
 * Output of one detector run. An insufficient result carries the default payload and
 * zero confidence, and is never promoted to the current pattern.
 */
@Value
public class DetectionResult {
    PatternType patternType;
    PatternPayload payload;
    int sampleSize;
    double confidence;
    boolean sufficientData;

    public static DetectionResult of(PatternPayload payload, int sampleSize, double confidence) {
        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        return new DetectionResult(payload.patternType(), payload, sampleSize, clamped, true);
    }

    public static DetectionResult insufficient(PatternPayload payload, int sampleSize) {
        return new DetectionResult(payload.patternType(), payload, sampleSize, 0.0, false);
    }
}
