package com.claude.patternlearning.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDateTime;

/**
 * The current, authoritative pattern for one tenant and one pattern type.
 */
@Entity
@Table(name = "conversion_patterns",
       uniqueConstraints = {
           @UniqueConstraint(columnNames = {"tenant_id", "pattern_type"})
       })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversionPattern {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false)
    private PatternType patternType;

    @Column(nullable = false)
    private Integer version;

    @Column(nullable = false, length = 100000)
    private String payload;

    @Column(name = "sample_size", nullable = false)
    private Integer sampleSize;

    @Column(nullable = false)
    private Double confidence;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;

    @Column(name = "valid_until", nullable = false)
    private LocalDateTime validUntil;

    public boolean isExpiredAt(LocalDateTime now) {
        return !validUntil.isAfter(now);
    }
}
