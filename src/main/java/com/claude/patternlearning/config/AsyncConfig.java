package com.claude.patternlearning.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for the learning pipeline.
 *
 * <p>Tenants run in parallel on {@code batchTaskExecutor}; inside one tenant run the four
 * detector steps run in parallel on {@code detectorTaskExecutor}. Scheduled and on-demand
 * triggers hand their work to {@code managementTaskExecutor}.
 */
@Configuration
public class AsyncConfig {

    /**
     * One thread per tenant run. The orchestrator submits tenants in waves of
     * {@code max-concurrent-tenants}, so at most 8 learn concurrently.
     */
    @Bean(name = "batchTaskExecutor")
    public Executor batchTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(500);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("TenantLearning-");

        // let running tenant jobs finish their store transactions on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        return executor;
    }

    /**
     * Runs the detector steps of the job split. Four steps per tenant run, so the pool is
     * sized for two concurrent tenants before steps start queuing.
     */
    @Bean(name = "detectorTaskExecutor")
    public TaskExecutor detectorTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Detector-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        return executor;
    }

    @Bean(name = "managementTaskExecutor")
    public Executor managementTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(20);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Management-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);

        executor.initialize();

        return executor;
    }
}
