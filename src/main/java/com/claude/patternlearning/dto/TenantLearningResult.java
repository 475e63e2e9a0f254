package com.claude.patternlearning.dto;

import com.claude.patternlearning.entity.LearningRunRecord.DetectorOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Result of one tenant's learning run: the outcome per pattern type, keyed by type code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TenantLearningResult {

    public enum Status {
        SUCCESS, PARTIAL, FAILED, SKIPPED
    }

    private String tenantId;
    private String runId;
    private Status status;
    private Map<String, DetectorOutcome> outcomes;
    private String message;

    public static TenantLearningResult skipped(String tenantId, String reason) {
        return TenantLearningResult.builder()
                .tenantId(tenantId)
                .status(Status.SKIPPED)
                .message(reason)
                .build();
    }

    public static TenantLearningResult failed(String tenantId, String runId, String reason) {
        return TenantLearningResult.builder()
                .tenantId(tenantId)
                .runId(runId)
                .status(Status.FAILED)
                .message(reason)
                .build();
    }
}
