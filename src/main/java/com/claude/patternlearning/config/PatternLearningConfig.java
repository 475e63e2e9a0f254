package com.claude.patternlearning.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.List;

@Configuration
public class PatternLearningConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Retries dataset loads and pattern writes. {@code max-attempts} counts the first call,
     * so the default of 3 means two retries. Only transient database failures are retried,
     * matched anywhere in the cause chain; encoding errors fail on the first attempt.
     */
    @Bean
    public RetryTemplate learningRetryTemplate(PatternLearningProperties properties) {
        PatternLearningProperties.Retry retry = properties.getRetry();
        return RetryTemplate.builder()
                .maxAttempts(retry.getMaxAttempts())
                .fixedBackoff(retry.getDelayMs())
                .retryOn(List.of(
                        TransientDataAccessException.class,
                        RecoverableDataAccessException.class,
                        TransactionException.class))
                .traversingCauses()
                .build();
    }

    @Bean
    public ThreadPoolTaskScheduler learningTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("LearningScheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }
}
