package com.claude.patternlearning.config;

import com.claude.patternlearning.batch.DetectorTasklet;
import com.claude.patternlearning.entity.PatternType;
import com.claude.patternlearning.service.TenantLearningService;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.FlowBuilder;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.flow.Flow;
import org.springframework.batch.core.job.flow.support.SimpleFlow;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;

/**
 * {@code patternLearningJob}: one run for one tenant, the four detectors as parallel
 * tasklet steps of a split flow.
 *
 * <p>Job parameters: {@code tenantId}, {@code runId}, {@code timestamp}.
 */
@Configuration
public class PatternLearningBatchConfig {

    public static final String JOB_NAME = "patternLearningJob";

    private final JobRepository jobRepository;
    private final TenantLearningService learningService;
    private final TaskExecutor detectorTaskExecutor;

    public PatternLearningBatchConfig(JobRepository jobRepository,
                                      TenantLearningService learningService,
                                      @Qualifier("detectorTaskExecutor") TaskExecutor detectorTaskExecutor) {
        this.jobRepository = jobRepository;
        this.learningService = learningService;
        this.detectorTaskExecutor = detectorTaskExecutor;
    }

    @Bean
    public Job patternLearningJob() {
        Flow detectors = new FlowBuilder<SimpleFlow>("detectorSplit")
                .split(detectorTaskExecutor)
                .add(detectorFlow(PatternType.WHO),
                     detectorFlow(PatternType.WHAT),
                     detectorFlow(PatternType.WHEN),
                     detectorFlow(PatternType.HOW))
                .build();

        return new JobBuilder(JOB_NAME, jobRepository)
                .start(detectors)
                .end()
                .build();
    }

    private Flow detectorFlow(PatternType patternType) {
        return new FlowBuilder<SimpleFlow>(patternType.getCode() + "Flow")
                .start(detectorStep(patternType))
                .build();
    }

    // the store opens its own transactions, the step only needs the batch metadata
    private Step detectorStep(PatternType patternType) {
        return new StepBuilder(patternType.getCode() + "DetectorStep", jobRepository)
                .tasklet(new DetectorTasklet(patternType, learningService), new ResourcelessTransactionManager())
                .build();
    }
}
