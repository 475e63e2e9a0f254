package com.claude.patternlearning.entity;

import java.util.Locale;

public enum Channel {
    EMAIL, SMS, LINKEDIN, VOICE;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
