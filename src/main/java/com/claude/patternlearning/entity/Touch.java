package com.claude.patternlearning.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import java.time.LocalDateTime;

/**
 * One outbound action toward a lead. Channel engines create it at send time and
 * attach a content snapshot; {@code ledToBooking} is set once per lead after conversion.
 */
@Entity
@Table(name = "touches", indexes = {
        @Index(name = "idx_touches_tenant_lead", columnList = "tenant_id, lead_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Touch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "lead_id", nullable = false)
    private Long leadId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Channel channel;

    @Column(name = "sent_at", nullable = false)
    private LocalDateTime sentAt;

    @Column(name = "touch_number")
    private Integer touchNumber;

    @Column(name = "sequence_id")
    private String sequenceId;

    private String subject;

    @Column(length = 10000)
    private String body;

    @Column(name = "content_snapshot", length = 4000)
    private String contentSnapshot;

    @Column(name = "led_to_booking")
    private Boolean ledToBooking = false;

    public boolean isBookingTouch() {
        return Boolean.TRUE.equals(ledToBooking);
    }
}
