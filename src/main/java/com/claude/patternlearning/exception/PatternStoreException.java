package com.claude.patternlearning.exception;

/**
 * The transactional write of a pattern and its history row failed.
 */
public class PatternStoreException extends PatternLearningException {
    private static final String DEFAULT_ERROR_CODE = "ERR-STORE-001";

    public PatternStoreException(String message) {
        super(message);
    }

    public PatternStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
