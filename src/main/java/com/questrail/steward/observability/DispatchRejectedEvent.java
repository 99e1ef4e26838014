package com.questrail.steward.observability;

import com.questrail.steward.dispatch.DispatchOutcome;

import java.time.Instant;

/**
 * An event that was stopped before any handler ran: duplicate, unrouted,
 * rate limited or forbidden.
 */
public record DispatchRejectedEvent(
    Instant timestamp,
    String eventId,
    String actorId,
    String discriminator,
    DispatchOutcome outcome
) {
}
