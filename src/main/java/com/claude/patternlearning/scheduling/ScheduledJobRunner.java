package com.claude.patternlearning.scheduling;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Runs named recurring jobs on a cron schedule and on demand.
 *
 * <p>A job returns a short description of what it did; an exception marks the run failed.
 */
public interface ScheduledJobRunner {

    void register(String name, String cron, Supplier<String> job);

    /**
     * Runs a registered job now, outside its schedule.
     *
     * @throws IllegalArgumentException if no job is registered under {@code name}
     */
    CompletableFuture<JobRunOutcome> trigger(String name);

    void report(String name, JobRunOutcome outcome);

    Optional<JobRunOutcome> lastOutcome(String name);
}
