package com.claude.patternlearning.exception;

import lombok.Getter;

/**
 * Base class for failures raised by the learning pipeline.
 * Every subclass carries a stable error code for logs and API responses.
 */
@Getter
public abstract class PatternLearningException extends RuntimeException {

    private final String errorCode;

    protected PatternLearningException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected PatternLearningException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
