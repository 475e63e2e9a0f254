package com.claude.patternlearning.batch;

import com.claude.patternlearning.entity.LearningRunRecord;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.service.TenantLearningService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.util.Map;

/**
 * Runs one detector for the tenant named in the job parameters. The outcome is written to
 * the step execution context under {@link #OUTCOME_KEY}; detector and store failures are
 * recorded by {@link TenantLearningService} and never fail the step.
 */
@Slf4j
public class DetectorTasklet implements Tasklet {

    public static final String OUTCOME_KEY = "detectorOutcome";

    private final PatternType patternType;
    private final TenantLearningService learningService;

    public DetectorTasklet(PatternType patternType, TenantLearningService learningService) {
        this.patternType = patternType;
        this.learningService = learningService;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        Map<String, Object> jobParameters = chunkContext.getStepContext().getJobParameters();
        String tenantId = (String) jobParameters.get("tenantId");
        String runId = (String) jobParameters.get("runId");

        log.debug("[{}] {} step started (run {})", tenantId, patternType, runId);
        LearningRunRecord.DetectorOutcome outcome = learningService.runDetector(tenantId, runId, patternType);

        chunkContext.getStepContext().getStepExecution().getExecutionContext()
                .putString(OUTCOME_KEY, outcome.name());
        if (outcome == LearningRunRecord.DetectorOutcome.STORED) {
            contribution.incrementWriteCount(1);
        }
        return RepeatStatus.FINISHED;
    }

    public PatternType getPatternType() {
        return patternType;
    }
}
