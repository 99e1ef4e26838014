package com.questrail.steward.dispatch.internal.ack;

import com.questrail.steward.channel.ChannelException;
import com.questrail.steward.channel.ChannelOperation;
import com.questrail.steward.channel.DeferMode;
import com.questrail.steward.channel.ResponseChannel;
import com.questrail.steward.dispatch.internal.time.MonotonicClock;
import com.questrail.steward.dispatch.internal.time.WallClock;
import com.questrail.steward.model.InboundEvent;
import com.questrail.steward.observability.AckTransitionEvent;
import com.questrail.steward.observability.ChannelFailureEvent;
import com.questrail.steward.observability.DispatchObservabilitySink;
import com.questrail.steward.observability.NullDispatchObservabilitySink;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AckStateMachine
 * =============================================================================
 * Tracks {@code UNACKED → DEFERRED → RESPONDED} per in-flight event and owns
 * the deferral primitive.
 *
 * <h2>Deferral outcomes</h2>
 * <ul>
 *   <li>Already deferred or responded: no remote call, success.</li>
 *   <li>{@code EXPIRED}: the deadline passed before the attempt. The event is
 *       marked responded-unreachable and nothing further is sent; the handler
 *       may still run for its side effects.</li>
 *   <li>{@code ALREADY_ACKED}: a race with the remote side; treated as success.</li>
 *   <li>Anything else: rethrown; the phase stays {@code UNACKED}.</li>
 * </ul>
 */
public final class AckStateMachine {

    private final ResponseChannel channel;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final DispatchObservabilitySink observabilitySink;

    private final Map<String, AckState> states = new ConcurrentHashMap<>();

    public AckStateMachine(ResponseChannel channel,
                           MonotonicClock clock,
                           WallClock wallClock,
                           DispatchObservabilitySink observabilitySink)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullDispatchObservabilitySink.INSTANCE);
    }

    /**
     * Registers a fresh state for an event entering dispatch.
     */
    public AckState begin(InboundEvent event) {
        Objects.requireNonNull(event, "event");
        return states.computeIfAbsent(event.id(), id -> new AckState(event));
    }

    /**
     * Returns the state of an in-flight event, creating one if the event is
     * being answered outside the router.
     */
    public AckState stateFor(InboundEvent event) {
        return begin(event);
    }

    public Optional<AckState> find(String eventId) {
        return Optional.ofNullable(states.get(eventId));
    }

    /**
     * Discards the state once handling completes.
     */
    public void release(String eventId) {
        states.remove(eventId);
    }

    public int inFlight() {
        return states.size();
    }

    /**
     * @return {@code true} if the event is now at least deferred; {@code false}
     *         if the exchange is unreachable
     * @throws ChannelException for non-recoverable deferral failures
     */
    public boolean ensureDeferred(InboundEvent event, DeferMode mode) {
        Objects.requireNonNull(mode, "mode");
        AckState state = stateFor(event);

        synchronized (state) {
            if (state.isUnreachable()) {
                return false;
            }
            if (state.phase().isAtLeast(AckPhase.DEFERRED)) {
                return true;
            }

            String trigger = "deferAck(" + mode + ")";
            try {
                channel.deferAck(event, mode);
            } catch (ChannelException e) {
                switch (e.error()) {
                    case EXPIRED -> {
                        reportFailure(event, ChannelOperation.DEFER_ACK, e);
                        markUnreachable(state, trigger + " expired");
                        return false;
                    }
                    case ALREADY_ACKED -> {
                        reportFailure(event, ChannelOperation.DEFER_ACK, e);
                        trigger = trigger + " raced";
                    }
                    default -> throw e;
                }
            }

            state.recordDeferMode(mode);
            advance(state, AckPhase.DEFERRED, trigger);
            return true;
        }
    }

    /**
     * Advances the phase if {@code next} is later than the current one.
     */
    public void advance(AckState state, AckPhase next, String trigger) {
        AckPhase from = state.phase();
        if (state.advanceTo(next, clock.nowNanos())) {
            observabilitySink.onAckTransition(new AckTransitionEvent(
                wallClock.now(), state.event().id(), from, next, trigger));
        }
    }

    /**
     * Marks the exchange dead: responded, with nothing visible to the actor.
     */
    public void markUnreachable(AckState state, String trigger) {
        state.markUnreachable();
        advance(state, AckPhase.RESPONDED, trigger);
    }

    private void reportFailure(InboundEvent event, ChannelOperation operation, ChannelException e) {
        observabilitySink.onChannelFailure(new ChannelFailureEvent(
            wallClock.now(), event.id(), operation, e.error(), e));
    }
}
