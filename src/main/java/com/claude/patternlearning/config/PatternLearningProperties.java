package com.claude.patternlearning.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the learning pipeline, bound from {@code pattern-learning.*}.
 */
@Data
@ConfigurationProperties(prefix = "pattern-learning")
public class PatternLearningProperties {

    private Detection detection = new Detection();
    private Store store = new Store();
    private Retry retry = new Retry();
    private Orchestrator orchestrator = new Orchestrator();
    private Health health = new Health();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Detection {
        // leads created before now - lookbackDays are ignored
        private int lookbackDays = 90;
        private int nonConvertingSampleFloor = 200;
        private int nonConvertingSampleMultiplier = 10;
    }

    @Data
    public static class Store {
        private double minConfidence = 0.10;
        private int minSampleSize = 20;
        private int validityDays = 14;
        private int expiringWindowDays = 3;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long delayMs = 1000;
    }

    @Data
    public static class Orchestrator {
        private Duration tenantTimeout = Duration.ofMinutes(30);
        // tenants submitted to batchTaskExecutor at a time
        private int maxConcurrentTenants = 8;
        private long staleRunMinutes = 120;
    }

    @Data
    public static class Health {
        private double minConfidence = 0.30;
        private int minSampleSize = 50;
        private int escalationThreshold = 3;
        private int historyWindow = 3;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private String learningCron = "0 0 3 * * SUN";
        private String healthCron = "0 0 6 * * *";
    }
}
