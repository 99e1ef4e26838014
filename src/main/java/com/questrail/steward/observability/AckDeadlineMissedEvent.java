package com.questrail.steward.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * The acknowledgment deadline passed while the event was still unacknowledged.
 */
public record AckDeadlineMissedEvent(
    Instant timestamp,
    String eventId,
    String discriminator,
    Duration deadline
) {
}
