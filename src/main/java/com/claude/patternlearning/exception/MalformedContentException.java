package com.claude.patternlearning.exception;

/**
 * A touch's content snapshot is missing or cannot be parsed.
 */
public class MalformedContentException extends PatternLearningException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CONTENT-001";

    public MalformedContentException(String message) {
        super(message);
    }

    public MalformedContentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
