package com.questrail.steward.observability;

import com.questrail.steward.channel.ChannelOperation;

import java.time.Instant;

/**
 * A response was not attempted because the exchange is unreachable or the
 * requested primitive is illegal in the current phase.
 */
public record ResponseSuppressedEvent(
    Instant timestamp,
    String eventId,
    ChannelOperation attempted,
    String reason
) {
}
