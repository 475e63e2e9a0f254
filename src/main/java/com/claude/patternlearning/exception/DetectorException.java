package com.claude.patternlearning.exception;

import com.claude.patternlearning.entity.PatternType;
import lombok.Getter;

/**
 * Unexpected failure inside one detector for one tenant.
 */
@Getter
public class DetectorException extends PatternLearningException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DET-001";

    private final String tenantId;
    private final PatternType patternType;

    public DetectorException(String tenantId, PatternType patternType, Throwable cause) {
        super(String.format("%s detector failed for tenant %s: %s",
                patternType.getCode(), tenantId, cause.getMessage()), cause);
        this.tenantId = tenantId;
        this.patternType = patternType;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
