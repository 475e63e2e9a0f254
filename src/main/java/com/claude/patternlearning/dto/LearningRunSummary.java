package com.claude.patternlearning.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LearningRunSummary {
    private String runId;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private int succeeded;
    private int partial;
    private int failed;
    private List<TenantLearningResult> tenants;
}
