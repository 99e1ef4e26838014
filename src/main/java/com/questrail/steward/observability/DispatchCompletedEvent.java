package com.questrail.steward.observability;

import com.questrail.steward.channel.DeferMode;
import com.questrail.steward.dispatch.DispatchOutcome;
import com.questrail.steward.dispatch.internal.ack.AckPhase;

import java.time.Duration;
import java.time.Instant;

/**
 * Final record for an event whose handler was invoked.
 *
 * @param deferMode how the event was deferred; null if it never was
 */
public record DispatchCompletedEvent(
    Instant timestamp,
    String eventId,
    String actorId,
    String discriminator,
    DispatchOutcome outcome,
    AckPhase finalPhase,
    boolean unreachable,
    DeferMode deferMode,
    Duration elapsed
) {
    /**
     * True when the handler ran but the actor was shown nothing: the exchange
     * expired, nothing ever acknowledged it, or a placeholder was posted and
     * never replaced. An {@link DeferMode#UPDATE} deferral left as is counts
     * as answered.
     */
    public boolean actorObservedNothing() {
        return unreachable
            || finalPhase == AckPhase.UNACKED
            || (finalPhase == AckPhase.DEFERRED && deferMode == DeferMode.REPLY_PLACEHOLDER);
    }
}
