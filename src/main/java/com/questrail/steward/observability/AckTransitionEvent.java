package com.questrail.steward.observability;

import com.questrail.steward.dispatch.internal.ack.AckPhase;

import java.time.Instant;

/**
 * Record of one acknowledgment phase advance.
 *
 * @param trigger the outbound primitive (or race) that caused the advance
 */
public record AckTransitionEvent(
    Instant timestamp,
    String eventId,
    AckPhase from,
    AckPhase to,
    String trigger
) {
}
