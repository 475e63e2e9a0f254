package com.claude.patternlearning.pattern;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.TreeMap;

/**
 * Weight vector over the four scoring components. Components sum to {@link #TARGET_SUM},
 * the remainder of the 100-point scale is reserved for the risk deduction.
 */
@Value
@Builder
@Jacksonized
public class ScoringWeights {

    public static final double TARGET_SUM = 0.85;
    public static final double MIN_WEIGHT = 0.05;
    public static final double MAX_WEIGHT = 0.50;

    public static final ScoringWeights DEFAULT = ScoringWeights.builder()
            .dataQuality(0.20)
            .authority(0.25)
            .companyFit(0.25)
            .timing(0.15)
            .build();

    double dataQuality;
    double authority;
    double companyFit;
    double timing;

    public static ScoringWeights of(double[] vector) {
        return ScoringWeights.builder()
                .dataQuality(vector[0])
                .authority(vector[1])
                .companyFit(vector[2])
                .timing(vector[3])
                .build();
    }

    public double[] toArray() {
        return new double[]{dataQuality, authority, companyFit, timing};
    }

    public double sum() {
        return dataQuality + authority + companyFit + timing;
    }

    public boolean isWithinBounds(double sumTolerance) {
        for (double w : toArray()) {
            if (Double.isNaN(w) || w < MIN_WEIGHT - 1e-9 || w > MAX_WEIGHT + 1e-9) {
                return false;
            }
        }
        return Math.abs(sum() - TARGET_SUM) <= sumTolerance;
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new TreeMap<>();
        map.put(ScoreComponent.DATA_QUALITY.getKey(), dataQuality);
        map.put(ScoreComponent.AUTHORITY.getKey(), authority);
        map.put(ScoreComponent.COMPANY_FIT.getKey(), companyFit);
        map.put(ScoreComponent.TIMING.getKey(), timing);
        return map;
    }
}
