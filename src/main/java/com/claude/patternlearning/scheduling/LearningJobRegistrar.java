package com.claude.patternlearning.scheduling;

import com.claude.patternlearning.config.PatternLearningProperties;
import com.claude.patternlearning.dto.HealthReport;
import com.claude.patternlearning.dto.LearningRunSummary;
import com.claude.patternlearning.service.PatternHealthMonitor;
import com.claude.patternlearning.service.PatternLearningOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Registers the weekly learning run and the daily health check once the application is up.
 */
@Component
@ConditionalOnProperty(prefix = "pattern-learning.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LearningJobRegistrar {

    public static final String WEEKLY_LEARNING = "weekly-pattern-learning";
    public static final String DAILY_HEALTH = "daily-pattern-health";

    private final ScheduledJobRunner jobRunner;
    private final PatternLearningOrchestrator orchestrator;
    private final PatternHealthMonitor healthMonitor;
    private final PatternLearningProperties properties;

    public LearningJobRegistrar(ScheduledJobRunner jobRunner,
                                PatternLearningOrchestrator orchestrator,
                                PatternHealthMonitor healthMonitor,
                                PatternLearningProperties properties) {
        this.jobRunner = jobRunner;
        this.orchestrator = orchestrator;
        this.healthMonitor = healthMonitor;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerJobs() {
        PatternLearningProperties.Scheduling scheduling = properties.getScheduling();

        jobRunner.register(WEEKLY_LEARNING, scheduling.getLearningCron(), () -> {
            LearningRunSummary summary = orchestrator.runLearningForAllTenants();
            return String.format("run %s: %d succeeded, %d partial, %d failed",
                    summary.getRunId(), summary.getSucceeded(), summary.getPartial(), summary.getFailed());
        });

        jobRunner.register(DAILY_HEALTH, scheduling.getHealthCron(), () -> {
            HealthReport report = healthMonitor.runHealthCheck();
            return String.format("%d patterns, %d warnings, escalated=%s",
                    report.getPatternsChecked(), report.getWarnings().size(), report.isEscalated());
        });
    }
}
