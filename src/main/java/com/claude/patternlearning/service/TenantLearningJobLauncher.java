package com.claude.patternlearning.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Launches {@code patternLearningJob} for one tenant and blocks until it finishes.
 */
@Component
@Slf4j
public class TenantLearningJobLauncher {

    private final JobLauncher jobLauncher;
    private final Job patternLearningJob;

    public TenantLearningJobLauncher(JobLauncher jobLauncher,
                                     @Qualifier("patternLearningJob") Job patternLearningJob) {
        this.jobLauncher = jobLauncher;
        this.patternLearningJob = patternLearningJob;
    }

    public JobExecution launch(String tenantId, String runId) throws JobExecutionException {
        JobParameters jobParameters = new JobParametersBuilder()
                .addString("tenantId", tenantId)
                .addString("runId", runId)
                .addLong("timestamp", System.currentTimeMillis())
                .toJobParameters();

        log.info("[{}] launching {} (run {})", tenantId, patternLearningJob.getName(), runId);
        JobExecution execution = jobLauncher.run(patternLearningJob, jobParameters);
        log.info("[{}] {} finished with status {}", tenantId, patternLearningJob.getName(), execution.getStatus());
        return execution;
    }
}
