package com.claude.patternlearning.optimizer;

import com.claude.patternlearning.pattern.ScoringWeights;
import lombok.Value;

@Value
public class OptimizationResult {
    ScoringWeights weights;
    OptimizationStatus status;
    int iterations;
    double loss;
    int rows;

    public static OptimizationResult fallback(OptimizationStatus status, int iterations, int rows) {
        return new OptimizationResult(ScoringWeights.DEFAULT, status, iterations, Double.NaN, rows);
    }

    public boolean isConverged() {
        return status == OptimizationStatus.CONVERGED;
    }
}
