package com.questrail.steward.observability;

import com.questrail.steward.channel.ChannelError;
import com.questrail.steward.channel.ChannelOperation;

import java.time.Instant;

/**
 * An outbound primitive failed.
 */
public record ChannelFailureEvent(
    Instant timestamp,
    String eventId,
    ChannelOperation operation,
    ChannelError error,
    Throwable cause
) {
    /**
     * Whether the failure was absorbed without escalation.
     */
    public boolean recovered() {
        return error.isRecoverable();
    }
}
