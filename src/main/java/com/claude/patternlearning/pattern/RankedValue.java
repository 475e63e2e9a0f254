package com.claude.patternlearning.pattern;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Conversion statistics for one value of a categorical field.
 */
@Value
@Builder
@Jacksonized
public class RankedValue {
    String value;
    double conversionRate;
    double lift;
    int conversions;
    int sampleSize;
}
