package com.claude.patternlearning.exception;

/**
 * A pattern payload or weight vector cannot be written to or read from its JSON form.
 */
public class PatternCodecException extends PatternLearningException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CODEC-001";

    public PatternCodecException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
