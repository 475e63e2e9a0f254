package com.claude.patternlearning.scheduling;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * How one execution of a registered job ended.
 */
@Value
public class JobRunOutcome {

    public enum Status {
        SUCCEEDED, FAILED
    }

    String jobName;
    Status status;
    LocalDateTime startedAt;
    LocalDateTime finishedAt;
    String message;

    public static JobRunOutcome succeeded(String jobName, LocalDateTime startedAt, LocalDateTime finishedAt, String message) {
        return new JobRunOutcome(jobName, Status.SUCCEEDED, startedAt, finishedAt, message);
    }

    public static JobRunOutcome failed(String jobName, LocalDateTime startedAt, LocalDateTime finishedAt, String message) {
        return new JobRunOutcome(jobName, Status.FAILED, startedAt, finishedAt, message);
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }
}
