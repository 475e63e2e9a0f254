package com.claude.patternlearning.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDateTime;

@Entity
@Table(name = "tenants")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", unique = true, nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    private TenantStatus status;

    @Column(name = "learning_enabled")
    private Boolean learningEnabled = true;

    @Column(name = "last_learning_run")
    private LocalDateTime lastLearningRun;

    @Column(name = "last_learning_status")
    @Enumerated(EnumType.STRING)
    private LearningStatus lastLearningStatus;

    @Column(name = "failure_count")
    private Integer failureCount = 0;

    @Column(name = "max_failures")
    private Integer maxFailures = 3;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum TenantStatus {
        ACTIVE, INACTIVE, SUSPENDED
    }

    public enum LearningStatus {
        PENDING, RUNNING, SUCCESS, PARTIAL, FAILED
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = TenantStatus.ACTIVE;
        }
        if (lastLearningStatus == null) {
            lastLearningStatus = LearningStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isEligibleForLearning() {
        return Boolean.TRUE.equals(learningEnabled) &&
               status == TenantStatus.ACTIVE &&
               failureCount < maxFailures &&
               lastLearningStatus != LearningStatus.RUNNING;
    }

    public void recordRunning(LocalDateTime now) {
        this.lastLearningRun = now;
        this.lastLearningStatus = LearningStatus.RUNNING;
    }

    public void recordSuccess(LocalDateTime now) {
        this.lastLearningRun = now;
        this.lastLearningStatus = LearningStatus.SUCCESS;
        this.failureCount = 0;
    }

    // some detectors failed; the failure budget is left as is
    public void recordPartial(LocalDateTime now) {
        this.lastLearningRun = now;
        this.lastLearningStatus = LearningStatus.PARTIAL;
    }

    public void recordFailure(LocalDateTime now) {
        this.lastLearningRun = now;
        this.lastLearningStatus = LearningStatus.FAILED;
        this.failureCount++;

        if (this.failureCount >= this.maxFailures) {
            this.learningEnabled = false;
        }
    }
}
