package com.claude.patternlearning.dto;

import com.claude.patternlearning.store.PatternLifecycle;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A current or historical pattern as served by the API. The payload is passed through
 * as stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatternResponse {
    private String tenantId;
    private String patternType;
    private Integer version;
    private Integer sampleSize;
    private Double confidence;
    private LocalDateTime computedAt;
    private LocalDateTime validUntil;
    // current patterns only
    private PatternLifecycle lifecycle;
    // history rows only
    private Boolean promoted;
    private Boolean insufficientData;
    private JsonNode payload;
}
