package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.Channel;
import com.claude.patternlearning.entity.Touch;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class TouchSample {
    Long id;
    Long leadId;
    Channel channel;
    LocalDateTime sentAt;
    Integer touchNumber;
    boolean bookingTouch;
    String contentSnapshot;

    public static TouchSample from(Touch touch) {
        return TouchSample.builder()
                .id(touch.getId())
                .leadId(touch.getLeadId())
                .channel(touch.getChannel())
                .sentAt(touch.getSentAt())
                .touchNumber(touch.getTouchNumber())
                .bookingTouch(touch.isBookingTouch())
                .contentSnapshot(touch.getContentSnapshot())
                .build();
    }
}
