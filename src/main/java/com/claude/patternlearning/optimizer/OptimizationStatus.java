package com.claude.patternlearning.optimizer;

public enum OptimizationStatus {
    CONVERGED,
    INSUFFICIENT_DATA,  // too few rows or a single class
    NOT_CONVERGED,
    INVALID_RESULT
}
