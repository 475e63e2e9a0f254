package com.claude.patternlearning.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDateTime;

/**
 * Audit row written for every computed pattern, promoted or not. Never updated.
 */
@Entity
@Table(name = "pattern_history", indexes = {
        @Index(name = "idx_pattern_history_pair", columnList = "tenant_id, pattern_type, version")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PatternHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false, updatable = false)
    private PatternType patternType;

    @Column(nullable = false, updatable = false)
    private Integer version;

    @Column(nullable = false, updatable = false, length = 100000)
    private String payload;

    @Column(name = "sample_size", nullable = false, updatable = false)
    private Integer sampleSize;

    @Column(nullable = false, updatable = false)
    private Double confidence;

    @Column(name = "computed_at", nullable = false, updatable = false)
    private LocalDateTime computedAt;

    @Column(name = "valid_until", nullable = false, updatable = false)
    private LocalDateTime validUntil;

    @Column(nullable = false, updatable = false)
    private Boolean promoted;

    @Column(name = "insufficient_data", nullable = false, updatable = false)
    private Boolean insufficientData;
}
