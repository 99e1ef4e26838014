package com.questrail.steward.observability;

import com.questrail.steward.dispatch.FailureClass;

import java.time.Duration;
import java.time.Instant;

/**
 * A handler raised an exception that was caught at the router boundary.
 */
public record HandlerFaultEvent(
    Instant timestamp,
    String eventId,
    String actorId,
    String discriminator,
    Duration elapsed,
    FailureClass failureClass,
    Throwable cause
) {
}
