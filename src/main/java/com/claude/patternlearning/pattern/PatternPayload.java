package com.claude.patternlearning.pattern;

import com.claude.patternlearning.entity.PatternType;

/**
 * Type-specific body of a mined pattern. Each {@link PatternType} has exactly one
 * implementation, so a payload can never be read against the wrong schema.
 */
public interface PatternPayload {

    PatternType patternType();
}
