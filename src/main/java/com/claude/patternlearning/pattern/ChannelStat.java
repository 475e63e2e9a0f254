package com.claude.patternlearning.pattern;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ChannelStat {
    double conversionRate;
    double lift;
    int conversions;
    int sampleSize;
}
