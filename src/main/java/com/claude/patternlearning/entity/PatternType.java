package com.claude.patternlearning.entity;

import com.claude.patternlearning.pattern.HowPatternPayload;
import com.claude.patternlearning.pattern.PatternPayload;
import com.claude.patternlearning.pattern.WhatPatternPayload;
import com.claude.patternlearning.pattern.WhenPatternPayload;
import com.claude.patternlearning.pattern.WhoPatternPayload;

import java.util.Locale;

/**
 * The four questions the pipeline answers. Each type is bound to exactly one payload schema.
 */
public enum PatternType {
    WHO("who", WhoPatternPayload.class),
    WHAT("what", WhatPatternPayload.class),
    WHEN("when", WhenPatternPayload.class),
    HOW("how", HowPatternPayload.class);

    private final String code;
    private final Class<? extends PatternPayload> payloadClass;

    PatternType(String code, Class<? extends PatternPayload> payloadClass) {
        this.code = code;
        this.payloadClass = payloadClass;
    }

    public String getCode() {
        return code;
    }

    public Class<? extends PatternPayload> getPayloadClass() {
        return payloadClass;
    }

    public static PatternType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (PatternType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown pattern type: " + code);
    }
}
