package com.questrail.steward.dispatch;

import com.questrail.steward.channel.ChannelError;
import com.questrail.steward.channel.ChannelException;
import com.questrail.steward.channel.ChannelOperation;
import com.questrail.steward.channel.DeferMode;
import com.questrail.steward.channel.ResponseChannel;
import com.questrail.steward.config.DispatchMessages;
import com.questrail.steward.dispatch.internal.ack.AckPhase;
import com.questrail.steward.dispatch.internal.ack.AckState;
import com.questrail.steward.dispatch.internal.ack.AckStateMachine;
import com.questrail.steward.dispatch.internal.time.MonotonicClock;
import com.questrail.steward.dispatch.internal.time.WallClock;
import com.questrail.steward.model.FormSpec;
import com.questrail.steward.model.InboundEvent;
import com.questrail.steward.model.ResponsePayload;
import com.questrail.steward.observability.ChannelFailureEvent;
import com.questrail.steward.observability.DispatchErrorEvent;
import com.questrail.steward.observability.DispatchObservabilitySink;
import com.questrail.steward.observability.NullDispatchObservabilitySink;
import com.questrail.steward.observability.ResponseSuppressedEvent;

import java.time.Duration;
import java.util.Objects;

/**
 * SafeResponder
 * =============================================================================
 * The only component that calls the response primitives of {@link ResponseChannel}
 * on behalf of handlers.
 *
 * <h2>Primitive selection</h2>
 * <pre>
 *   UNACKED   → openResponse   → RESPONDED
 *   DEFERRED  → editResponse   → RESPONDED
 *   RESPONDED → followUp
 * </pre>
 * Exactly one opening call (open or deferred edit) is issued per event; the
 * choice and the phase update happen under the event's {@link AckState} lock.
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>{@code EXPIRED}: logged as a warning, the exchange is marked
 *       unreachable, later calls become no-ops.</li>
 *   <li>{@code ALREADY_ACKED}: logged as a warning, not retried.</li>
 *   <li>Anything else: one follow-up carrying the generic failure text. If that
 *       fails too, the failure is reported at error level.</li>
 * </ul>
 * Nothing thrown by the channel escapes {@link #respond}, {@link #errorReply}
 * or {@link #showForm}.
 */
public final class SafeResponder {

    private final ResponseChannel channel;
    private final AckStateMachine acks;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration responseWindow;
    private final DispatchMessages messages;
    private final DispatchObservabilitySink observabilitySink;

    public SafeResponder(ResponseChannel channel,
                         AckStateMachine acks,
                         MonotonicClock clock,
                         WallClock wallClock,
                         Duration responseWindow,
                         DispatchMessages messages,
                         DispatchObservabilitySink observabilitySink)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.acks = Objects.requireNonNull(acks, "acks");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.responseWindow = Objects.requireNonNull(responseWindow, "responseWindow");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullDispatchObservabilitySink.INSTANCE);
    }

    /**
     * Sends {@code payload} using whichever primitive the current phase allows.
     */
    public void respond(InboundEvent event, ResponsePayload payload) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(payload, "payload");
        AckState state = acks.stateFor(event);

        synchronized (state) {
            ChannelOperation operation = operationFor(state.phase());
            if (!reachable(state, operation)) {
                return;
            }
            try {
                switch (operation) {
                    case OPEN_RESPONSE -> channel.openResponse(event, payload);
                    case EDIT_RESPONSE -> channel.editResponse(event, payload);
                    default -> channel.followUp(event, payload);
                }
                acks.advance(state, AckPhase.RESPONDED, operation.name());
            } catch (RuntimeException e) {
                handleFailure(state, operation, asChannelException(e));
            }
        }
    }

    public void respond(InboundEvent event, String content) {
        respond(event, ResponsePayload.visible(content));
    }

    /**
     * Private error message that also clears buttons and forms from the
     * message being answered, so the dead exchange cannot be retried from it.
     */
    public void errorReply(InboundEvent event, String message) {
        respond(event, ResponsePayload.error(message));
    }

    /**
     * Defers acknowledgment; idempotent. See {@link AckStateMachine#ensureDeferred}.
     *
     * @return {@code false} if the exchange is unreachable
     * @throws ChannelException for non-recoverable deferral failures
     */
    public boolean ensureDeferred(InboundEvent event, DeferMode mode) {
        return acks.ensureDeferred(event, mode);
    }

    /**
     * Presents a form. Forms can only be the opening response; in any other
     * phase the call is refused and reported.
     *
     * @return {@code true} if the form was shown
     */
    public boolean showForm(InboundEvent event, FormSpec form) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(form, "form");
        AckState state = acks.stateFor(event);

        synchronized (state) {
            if (!reachable(state, ChannelOperation.SHOW_FORM)) {
                return false;
            }
            if (state.phase() != AckPhase.UNACKED) {
                suppressed(event, ChannelOperation.SHOW_FORM,
                    "a form must be the opening response but the event is " + state.phase());
                return false;
            }
            try {
                channel.showForm(event, form);
                acks.advance(state, AckPhase.RESPONDED, ChannelOperation.SHOW_FORM.name());
                return true;
            } catch (RuntimeException e) {
                handleFailure(state, ChannelOperation.SHOW_FORM, asChannelException(e));
                return false;
            }
        }
    }

    public AckPhase phaseOf(InboundEvent event) {
        return acks.stateFor(event).phase();
    }

    private static ChannelOperation operationFor(AckPhase phase) {
        switch (phase) {
            case UNACKED:
                return ChannelOperation.OPEN_RESPONSE;
            case DEFERRED:
                return ChannelOperation.EDIT_RESPONSE;
            default:
                return ChannelOperation.FOLLOW_UP;
        }
    }

    private boolean reachable(AckState state, ChannelOperation attempted) {
        InboundEvent event = state.event();
        if (state.isUnreachable()) {
            suppressed(event, attempted, "exchange is unreachable; the acknowledgment deadline expired");
            return false;
        }
        if (state.phase() != AckPhase.UNACKED
                && clock.nowNanos() - state.acknowledgedAtNanos() > responseWindow.toNanos()) {
            acks.markUnreachable(state, "response window elapsed");
            suppressed(event, attempted, "response window of " + responseWindow.toMinutes() + " min elapsed");
            return false;
        }
        return true;
    }

    private void handleFailure(AckState state, ChannelOperation operation, ChannelException failure) {
        InboundEvent event = state.event();
        observabilitySink.onChannelFailure(new ChannelFailureEvent(
            wallClock.now(), event.id(), operation, failure.error(), failure));

        switch (failure.error()) {
            case EXPIRED -> acks.markUnreachable(state, operation + " expired");
            case ALREADY_ACKED -> acks.advance(state, AckPhase.DEFERRED, operation + " raced");
            default -> deliverFallback(state);
        }
    }

    private void deliverFallback(AckState state) {
        InboundEvent event = state.event();
        try {
            channel.followUp(event, ResponsePayload.error(messages.genericFailure()));
            acks.advance(state, AckPhase.RESPONDED, "fallback " + ChannelOperation.FOLLOW_UP);
        } catch (RuntimeException e) {
            observabilitySink.onError(new DispatchErrorEvent(
                wallClock.now(),
                "Fallback follow-up failed for event " + event.id() + "; giving up",
                e));
        }
    }

    private void suppressed(InboundEvent event, ChannelOperation attempted, String reason) {
        observabilitySink.onResponseSuppressed(new ResponseSuppressedEvent(
            wallClock.now(), event.id(), attempted, reason));
    }

    private static ChannelException asChannelException(RuntimeException e) {
        if (e instanceof ChannelException channelFailure) {
            return channelFailure;
        }
        return new ChannelException(ChannelError.UNKNOWN, String.valueOf(e.getMessage()), e);
    }
}
