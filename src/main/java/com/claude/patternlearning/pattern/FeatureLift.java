package com.claude.patternlearning.pattern;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Content feature statistics. {@code frequency} is the share of converting touches
 * carrying the feature, {@code lift} compares its rate to the overall rate.
 */
@Value
@Builder
@Jacksonized
public class FeatureLift {
    String feature;
    double frequency;
    double conversionRate;
    double lift;
    int sampleSize;
}
