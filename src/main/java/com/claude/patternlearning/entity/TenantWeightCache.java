package com.claude.patternlearning.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDateTime;

/**
 * Denormalized copy of the promoted WHO weights, read by the scorer.
 * Only the pattern store writes it.
 */
@Entity
@Table(name = "tenant_weight_cache")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TenantWeightCache {

    @Id
    @Column(name = "tenant_id")
    private String tenantId;

    @Column(nullable = false, length = 1000)
    private String weights;

    @Column(name = "sample_count", nullable = false)
    private Integer sampleCount;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "valid_until", nullable = false)
    private LocalDateTime validUntil;
}
