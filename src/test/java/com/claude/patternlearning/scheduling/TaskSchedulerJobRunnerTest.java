package com.claude.patternlearning.scheduling;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskSchedulerJobRunner")
class TaskSchedulerJobRunnerTest {

    private static final String CRON = "0 0 3 * * SUN";

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> scheduledFuture;

    private TaskSchedulerJobRunner runner;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T03:00:00Z"), ZoneOffset.UTC);
        runner = new TaskSchedulerJobRunner(taskScheduler, Runnable::run, clock);
        lenient().doReturn(scheduledFuture).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Test
    @DisplayName("records the message of a job triggered on demand")
    void triggerSucceeds() {
        runner.register("learning", CRON, () -> "3 tenants");

        JobRunOutcome outcome = runner.trigger("learning").join();

        assertThat(outcome.isSucceeded()).isTrue();
        assertThat(outcome.getMessage()).isEqualTo("3 tenants");
        assertThat(runner.lastOutcome("learning")).contains(outcome);
    }

    @Test
    @DisplayName("turns a thrown exception into a failed outcome")
    void triggerFails() {
        runner.register("health", CRON, () -> {
            throw new IllegalStateException("database down");
        });

        JobRunOutcome outcome = runner.trigger("health").join();

        assertThat(outcome.getStatus()).isEqualTo(JobRunOutcome.Status.FAILED);
        assertThat(outcome.getMessage()).isEqualTo("database down");
        assertThat(runner.lastOutcome("health")).contains(outcome);
    }

    @Test
    @DisplayName("rejects triggers for unknown jobs")
    void unknownJob() {
        assertThatThrownBy(() -> runner.trigger("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
        assertThat(runner.lastOutcome("missing")).isEmpty();
    }

    @Test
    @DisplayName("runs the job when the cron trigger fires")
    void cronFiring() {
        runner.register("learning", CRON, () -> "done");

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), any(Trigger.class));
        task.getValue().run();

        assertThat(runner.lastOutcome("learning")).hasValueSatisfying(o -> assertThat(o.isSucceeded()).isTrue());
    }

    @Test
    @DisplayName("cancels the previous schedule when a job is registered again")
    void reRegister() {
        runner.register("learning", CRON, () -> "first");
        ScheduledFuture<?> second = mock(ScheduledFuture.class);
        doReturn(second).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

        runner.register("learning", "0 0 4 * * SUN", () -> "second");

        verify(scheduledFuture).cancel(false);
        assertThat(runner.trigger("learning").join().getMessage()).isEqualTo("second");

        runner.destroy();
        verify(second).cancel(false);
    }
}
