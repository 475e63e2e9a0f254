package com.claude.patternlearning.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthWarning {

    public enum Kind {
        EXPIRED,
        EXPIRING_SOON,
        LOW_SAMPLE_SIZE,
        LOW_CONFIDENCE,
        WEIGHT_OUT_OF_BOUNDS,
        PERSISTENT_LOW_CONFIDENCE,
        REPEATED_RUN_FAILURE
    }

    public enum Severity {
        LOW, MEDIUM, HIGH
    }

    private String tenantId;
    private String patternType;
    private Kind kind;
    private Severity severity;
    private String message;
}
