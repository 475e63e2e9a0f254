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
public class BackfillResult {
    private String tenantId;
    private int snapshotsRebuilt;
    private int scoresComputed;
    private int bookingFlagsSet;
    private TenantLearningResult learning;
}
