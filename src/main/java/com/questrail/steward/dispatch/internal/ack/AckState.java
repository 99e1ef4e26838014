package com.questrail.steward.dispatch.internal.ack;

import com.questrail.steward.channel.DeferMode;
import com.questrail.steward.model.InboundEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * AckState
 * -----------------------------------------------------------------------------
 * Per-event acknowledgment record, created at dispatch and discarded when
 * handling completes.
 *
 * <p>The instance is also the lock that serializes outbound calls for its
 * event: whoever decides which primitive to use holds it until the phase has
 * been updated. Only {@link AckStateMachine} mutates it. Reads never take the
 * lock, so timer callbacks are not held up behind an outbound call in
 * progress.</p>
 */
public final class AckState {

    private final InboundEvent event;

    private volatile AckPhase phase = AckPhase.UNACKED;
    private volatile boolean unreachable;
    private volatile DeferMode deferMode;
    // Written before phase leaves UNACKED; visible to any reader that sees the new phase.
    private volatile long acknowledgedAtNanos;

    AckState(InboundEvent event) {
        this.event = Objects.requireNonNull(event, "event");
    }

    public InboundEvent event() {
        return event;
    }

    public AckPhase phase() {
        return phase;
    }

    /**
     * True once the exchange is dead (deadline expired or response window
     * elapsed). No further outbound call is attempted.
     */
    public boolean isUnreachable() {
        return unreachable;
    }

    public Optional<DeferMode> deferMode() {
        return Optional.ofNullable(deferMode);
    }

    /**
     * Monotonic tick of the first acknowledgment (deferral or opening response).
     * Meaningless while {@link #phase()} is {@link AckPhase#UNACKED}.
     */
    public long acknowledgedAtNanos() {
        return acknowledgedAtNanos;
    }

    synchronized boolean advanceTo(AckPhase next, long nowNanos) {
        if (!next.isAtLeast(phase) || next == phase) {
            return false;
        }
        if (phase == AckPhase.UNACKED) {
            acknowledgedAtNanos = nowNanos;
        }
        phase = next;
        return true;
    }

    synchronized void recordDeferMode(DeferMode mode) {
        this.deferMode = mode;
    }

    synchronized void markUnreachable() {
        unreachable = true;
    }
}
