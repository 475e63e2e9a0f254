package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.PatternType;

/**
 * A stateless analysis over one tenant's outcome history.
 * Implementations must be deterministic: the same dataset always yields the same result.
 */
public interface PatternDetector {

    PatternType getPatternType();

    DetectionResult detect(LearningDataset dataset);
}
