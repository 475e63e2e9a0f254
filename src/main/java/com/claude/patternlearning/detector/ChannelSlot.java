package com.claude.patternlearning.detector;

import com.claude.patternlearning.entity.Channel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One position of a fixed-length channel sequence. {@link #NONE} marks a position the
 * lead's sequence never reached.
 */
public enum ChannelSlot {
    EMAIL, SMS, LINKEDIN, VOICE, NONE;

    public static ChannelSlot of(Channel channel) {
        return channel == null ? NONE : valueOf(channel.name());
    }

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Truncates or pads the channel order to exactly {@code capacity} slots.
     */
    public static List<ChannelSlot> fixedLength(List<Channel> channels, int capacity) {
        List<ChannelSlot> slots = new ArrayList<>(capacity);
        for (int i = 0; i < capacity; i++) {
            slots.add(i < channels.size() ? of(channels.get(i)) : NONE);
        }
        return Collections.unmodifiableList(slots);
    }
}
