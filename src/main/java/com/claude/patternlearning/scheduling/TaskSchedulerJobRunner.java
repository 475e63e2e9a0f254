package com.claude.patternlearning.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * {@link ScheduledJobRunner} on Spring's {@link TaskScheduler}. Cron firings run on the
 * scheduler threads; manual triggers run on {@code managementTaskExecutor}.
 */
@Component
@Slf4j
public class TaskSchedulerJobRunner implements ScheduledJobRunner, DisposableBean {

    private final TaskScheduler taskScheduler;
    private final Executor managementTaskExecutor;
    private final Clock clock;

    private final ConcurrentHashMap<String, Supplier<String>> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, JobRunOutcome> outcomes = new ConcurrentHashMap<>();

    public TaskSchedulerJobRunner(TaskScheduler taskScheduler,
                                  @Qualifier("managementTaskExecutor") Executor managementTaskExecutor,
                                  Clock clock) {
        this.taskScheduler = taskScheduler;
        this.managementTaskExecutor = managementTaskExecutor;
        this.clock = clock;
    }

    @Override
    public void register(String name, String cron, Supplier<String> job) {
        CronTrigger trigger = new CronTrigger(cron);
        jobs.put(name, job);
        ScheduledFuture<?> previous = schedules.put(name, taskScheduler.schedule(() -> execute(name), trigger));
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("Registered job {} with cron '{}'", name, cron);
    }

    @Override
    public CompletableFuture<JobRunOutcome> trigger(String name) {
        if (!jobs.containsKey(name)) {
            throw new IllegalArgumentException("No job registered under " + name);
        }
        log.info("Manual trigger of job {}", name);
        return CompletableFuture.supplyAsync(() -> execute(name), managementTaskExecutor);
    }

    @Override
    public void report(String name, JobRunOutcome outcome) {
        outcomes.put(name, outcome);
        if (outcome.isSucceeded()) {
            log.info("Job {} succeeded: {}", name, outcome.getMessage());
        } else {
            log.error("Job {} failed: {}", name, outcome.getMessage());
        }
    }

    @Override
    public Optional<JobRunOutcome> lastOutcome(String name) {
        return Optional.ofNullable(outcomes.get(name));
    }

    JobRunOutcome execute(String name) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        JobRunOutcome outcome;
        try {
            String message = jobs.get(name).get();
            outcome = JobRunOutcome.succeeded(name, startedAt, LocalDateTime.now(clock), message);
        } catch (RuntimeException e) {
            log.error("Job {} threw", name, e);
            outcome = JobRunOutcome.failed(name, startedAt, LocalDateTime.now(clock), e.getMessage());
        }
        report(name, outcome);
        return outcome;
    }

    @Override
    public void destroy() {
        schedules.values().forEach(future -> future.cancel(false));
        schedules.clear();
    }
}
