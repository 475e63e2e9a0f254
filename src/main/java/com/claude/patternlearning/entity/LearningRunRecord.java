package com.claude.patternlearning.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDateTime;

/**
 * Outcome of one detector for one tenant within one learning run.
 */
@Entity
@Table(name = "learning_run_records",
       uniqueConstraints = {
           @UniqueConstraint(columnNames = {"run_id", "tenant_id", "pattern_type"})
       })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LearningRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false)
    private String runId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false)
    private PatternType patternType;

    @Enumerated(EnumType.STRING)
    private RunStatus status;

    @Enumerated(EnumType.STRING)
    private DetectorOutcome outcome;

    @Column(name = "sample_size")
    private Integer sampleSize;

    private Double confidence;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public enum RunStatus {
        RUNNING,
        COMPLETED,
        FAILED
    }

    public enum DetectorOutcome {
        STORED,             // promoted to the current pattern
        RETAINED_PREVIOUS,  // history only, thresholds not cleared
        INSUFFICIENT_DATA,
        DETECTOR_FAILED,
        STORE_FAILED;

        public boolean isFailure() {
            return this == DETECTOR_FAILED || this == STORE_FAILED;
        }
    }

    public void startProcessing(LocalDateTime now) {
        this.status = RunStatus.RUNNING;
        this.startedAt = now;
        this.errorMessage = null;
    }

    public void completeProcessing(DetectorOutcome outcome, int sampleSize, double confidence, LocalDateTime now) {
        this.status = RunStatus.COMPLETED;
        this.outcome = outcome;
        this.sampleSize = sampleSize;
        this.confidence = confidence;
        this.completedAt = now;
    }

    public void failProcessing(DetectorOutcome outcome, String error, LocalDateTime now) {
        this.status = RunStatus.FAILED;
        this.outcome = outcome;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        this.completedAt = now;
    }

    public boolean isFailed() {
        return status == RunStatus.FAILED;
    }
}
