package com.claude.patternlearning.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * A prospect pursued through an outreach sequence. Written by the ingestion and
 * engagement side; the learning pipeline only reads it, apart from backfill.
 */
@Entity
@Table(name = "leads", indexes = {
        @Index(name = "idx_leads_tenant_status", columnList = "tenant_id, status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    private String firstName;
    private String companyName;
    private String title;
    private String industry;
    private Integer employeeCount;
    private String country;

    // timing signals
    private Boolean newRole = false;
    private Boolean hiring = false;
    private Boolean recentlyFunded = false;

    // data quality signals
    private Boolean emailVerified = false;
    private Boolean hasPhone = false;
    private Boolean hasLinkedin = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LeadStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "score_components", length = 2000)
    private Map<String, Double> scoreComponents;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "weights_used", length = 2000)
    private Map<String, Double> weightsUsed;

    private Integer score;

    private LocalDateTime scoredAt;
    private LocalDateTime convertedAt;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum LeadStatus {
        CONVERTED, UNSUBSCRIBED, BOUNCED, NOT_INTERESTED, DEAD, ACTIVE;

        public static final Set<LeadStatus> TERMINAL = EnumSet.of(
                CONVERTED, UNSUBSCRIBED, BOUNCED, NOT_INTERESTED, DEAD);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = LeadStatus.ACTIVE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isConverted() {
        return status == LeadStatus.CONVERTED;
    }

    public boolean hasScoreComponents() {
        return scoreComponents != null && !scoreComponents.isEmpty();
    }
}
