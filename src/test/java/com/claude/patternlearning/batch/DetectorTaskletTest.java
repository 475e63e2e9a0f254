package com.claude.patternlearning.batch;

import com.claude.patternlearning.entity.LearningRunRecord.DetectorOutcome;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.service.TenantLearningService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.scope.context.StepContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.batch.test.MetaDataInstanceFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectorTaskletTest {

    @Mock
    private TenantLearningService learningService;

    private StepExecution stepExecution;
    private StepContribution contribution;
    private ChunkContext chunkContext;

    @BeforeEach
    void setUp() {
        stepExecution = MetaDataInstanceFactory.createStepExecution(new JobParametersBuilder()
                .addString("tenantId", "tenant-a")
                .addString("runId", "20260301T030000-abcd1234")
                .toJobParameters());
        contribution = stepExecution.createStepContribution();
        chunkContext = new ChunkContext(new StepContext(stepExecution));
    }

    @Test
    void recordsAStoredPatternAsOneWrite() throws Exception {
        when(learningService.runDetector("tenant-a", "20260301T030000-abcd1234", PatternType.WHO))
                .thenReturn(DetectorOutcome.STORED);
        DetectorTasklet tasklet = new DetectorTasklet(PatternType.WHO, learningService);

        RepeatStatus status = tasklet.execute(contribution, chunkContext);

        assertThat(status).isEqualTo(RepeatStatus.FINISHED);
        assertThat(stepExecution.getExecutionContext().getString(DetectorTasklet.OUTCOME_KEY)).isEqualTo("STORED");
        assertThat(contribution.getWriteCount()).isEqualTo(1);
    }

    @Test
    void detectorFailureDoesNotFailTheStep() throws Exception {
        when(learningService.runDetector("tenant-a", "20260301T030000-abcd1234", PatternType.WHAT))
                .thenReturn(DetectorOutcome.DETECTOR_FAILED);
        DetectorTasklet tasklet = new DetectorTasklet(PatternType.WHAT, learningService);

        RepeatStatus status = tasklet.execute(contribution, chunkContext);

        assertThat(status).isEqualTo(RepeatStatus.FINISHED);
        assertThat(stepExecution.getExecutionContext().getString(DetectorTasklet.OUTCOME_KEY))
                .isEqualTo("DETECTOR_FAILED");
        assertThat(contribution.getWriteCount()).isZero();
        assertThat(tasklet.getPatternType()).isEqualTo(PatternType.WHAT);
    }
}
