package com.questrail.steward.dispatch;

import com.questrail.steward.config.DispatchMessages;
import com.questrail.steward.dispatch.internal.ack.AckDeadlineWatchdog;
import com.questrail.steward.dispatch.internal.ack.AckState;
import com.questrail.steward.dispatch.internal.ack.AckStateMachine;
import com.questrail.steward.dispatch.internal.admission.DeduplicationRegistry;
import com.questrail.steward.dispatch.internal.admission.RateLimitPolicy;
import com.questrail.steward.dispatch.internal.admission.SlidingWindowRateLimiter;
import com.questrail.steward.dispatch.internal.time.Cancellable;
import com.questrail.steward.dispatch.internal.time.MonotonicClock;
import com.questrail.steward.dispatch.internal.time.WallClock;
import com.questrail.steward.model.EventType;
import com.questrail.steward.model.InboundEvent;
import com.questrail.steward.model.ResponsePayload;
import com.questrail.steward.observability.DispatchCompletedEvent;
import com.questrail.steward.observability.DispatchObservabilitySink;
import com.questrail.steward.observability.DispatchRejectedEvent;
import com.questrail.steward.observability.HandlerFaultEvent;
import com.questrail.steward.observability.NullDispatchObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * EventRouter
 * =============================================================================
 * Entry point for every inbound event.
 *
 * <h2>Dispatch sequence</h2>
 * <ol>
 *   <li>Deduplicate by event id. A duplicate is logged and dropped; nothing is sent.</li>
 *   <li>Resolve a handler from the {@link HandlerRegistry}. No match: the actor
 *       is told the action is unavailable.</li>
 *   <li>Check the registration's required permission, then its rate limit.
 *       Either rejection sends one private message; the handler never runs.</li>
 *   <li>Issue the registration's automatic deferral, if any.</li>
 *   <li>Invoke the handler. Any exception is caught here, reported with actor,
 *       discriminator, elapsed time and failure class, and answered with one
 *       generic failure through the {@link SafeResponder}.</li>
 * </ol>
 * The dedup entry created in step 1 expires on its own timer.
 *
 * <h2>Threading</h2>
 * {@link #dispatch} is safe to call from several threads for distinct events.
 * It never throws for handler or channel failures, including {@link Error}s
 * raised by a handler.
 */
public final class EventRouter {

    private final HandlerRegistry registry;
    private final DeduplicationRegistry dedup;
    private final SlidingWindowRateLimiter rateLimiter;
    private final AckStateMachine acks;
    private final AckDeadlineWatchdog watchdog;
    private final SafeResponder responder;
    private final DispatchMessages messages;
    private final RateLimitPolicy defaultRateLimit;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final DispatchObservabilitySink observabilitySink;

    private EventRouter(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.dedup = Objects.requireNonNull(builder.dedup, "dedup");
        this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
        this.acks = Objects.requireNonNull(builder.acks, "acks");
        this.watchdog = Objects.requireNonNull(builder.watchdog, "watchdog");
        this.responder = Objects.requireNonNull(builder.responder, "responder");
        this.messages = Objects.requireNonNull(builder.messages, "messages");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.wallClock = Objects.requireNonNull(builder.wallClock, "wallClock");
        this.defaultRateLimit = builder.defaultRateLimit;
        this.observabilitySink = Objects.requireNonNullElse(builder.observabilitySink, NullDispatchObservabilitySink.INSTANCE);
    }

    public DispatchOutcome dispatch(InboundEvent event) {
        Objects.requireNonNull(event, "event");
        long startedNanos = clock.nowNanos();

        if (dedup.seen(event.id())) {
            reject(event, DispatchOutcome.DUPLICATE);
            return DispatchOutcome.DUPLICATE;
        }

        AckState state = acks.begin(event);
        Cancellable deadlineWatch = watchdog.arm(state);
        try {
            Optional<HandlerRegistration> match = registry.resolve(event);
            if (match.isEmpty()) {
                reject(event, DispatchOutcome.UNROUTED);
                responder.errorReply(event, event.type() == EventType.COMMAND
                    ? messages.unknownCommand()
                    : messages.notAvailable());
                return DispatchOutcome.UNROUTED;
            }

            HandlerRegistration registration = match.get();
            Optional<DispatchOutcome> refusal = admit(event, registration);
            if (refusal.isPresent()) {
                return refusal.get();
            }

            DispatchOutcome outcome = invoke(event, registration, startedNanos);
            observabilitySink.onDispatchCompleted(new DispatchCompletedEvent(
                wallClock.now(),
                event.id(),
                event.actorId(),
                event.discriminator(),
                outcome,
                state.phase(),
                state.isUnreachable(),
                state.deferMode().orElse(null),
                elapsedSince(startedNanos)));
            return outcome;
        } finally {
            deadlineWatch.cancel();
            acks.release(event.id());
            dedup.markHandled(event.id());
        }
    }

    public HandlerRegistry registry() {
        return registry;
    }

    /**
     * Permission and rate-limit checks. Returns the refusal, if any, after
     * answering the actor.
     */
    private Optional<DispatchOutcome> admit(InboundEvent event, HandlerRegistration registration) {
        Optional<String> permission = registration.permission();
        if (permission.isPresent() && !event.hasPermission(permission.get())) {
            reject(event, DispatchOutcome.FORBIDDEN);
            responder.respond(event, ResponsePayload.ephemeral(messages.permissionDenied()));
            return Optional.of(DispatchOutcome.FORBIDDEN);
        }

        Optional<RateLimitPolicy> limit = registration.rateLimitPolicy()
            .or(() -> Optional.ofNullable(defaultRateLimit));
        if (limit.isPresent() && !rateLimiter.allow(event.actorId(), registration.action(), limit.get())) {
            reject(event, DispatchOutcome.RATE_LIMITED);
            responder.respond(event, ResponsePayload.ephemeral(messages.rateLimited()));
            return Optional.of(DispatchOutcome.RATE_LIMITED);
        }
        return Optional.empty();
    }

    private DispatchOutcome invoke(InboundEvent event, HandlerRegistration registration, long startedNanos) {
        try {
            if (registration.autoDeferMode().isPresent()) {
                // An expired deferral still lets the handler run for its side effects.
                acks.ensureDeferred(event, registration.autoDeferMode().get());
            }
            registration.handler().handle(event, responder);
            return DispatchOutcome.HANDLED;
        } catch (PermissionDeniedException e) {
            reject(event, DispatchOutcome.FORBIDDEN);
            responder.respond(event, ResponsePayload.ephemeral(
                e.getMessage() != null ? e.getMessage() : messages.permissionDenied()));
            return DispatchOutcome.FORBIDDEN;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            observabilitySink.onHandlerFault(new HandlerFaultEvent(
                wallClock.now(),
                event.id(),
                event.actorId(),
                event.discriminator(),
                elapsedSince(startedNanos),
                FailureClass.classify(e),
                e));
            responder.errorReply(event, messages.genericFailure());
            return DispatchOutcome.FAILED;
        }
    }

    private void reject(InboundEvent event, DispatchOutcome outcome) {
        observabilitySink.onRejected(new DispatchRejectedEvent(
            wallClock.now(), event.id(), event.actorId(), event.discriminator(), outcome));
    }

    private Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(clock.nowNanos() - startedNanos);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private HandlerRegistry registry;
        private DeduplicationRegistry dedup;
        private SlidingWindowRateLimiter rateLimiter;
        private AckStateMachine acks;
        private AckDeadlineWatchdog watchdog;
        private SafeResponder responder;
        private DispatchMessages messages = DispatchMessages.defaults();
        private RateLimitPolicy defaultRateLimit;
        private MonotonicClock clock;
        private WallClock wallClock;
        private DispatchObservabilitySink observabilitySink = NullDispatchObservabilitySink.INSTANCE;

        public Builder withRegistry(HandlerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withDeduplication(DeduplicationRegistry dedup) {
            this.dedup = dedup;
            return this;
        }

        public Builder withRateLimiter(SlidingWindowRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder withAckStateMachine(AckStateMachine acks) {
            this.acks = acks;
            return this;
        }

        public Builder withWatchdog(AckDeadlineWatchdog watchdog) {
            this.watchdog = watchdog;
            return this;
        }

        public Builder withResponder(SafeResponder responder) {
            this.responder = responder;
            return this;
        }

        public Builder withMessages(DispatchMessages messages) {
            this.messages = messages;
            return this;
        }

        public Builder withDefaultRateLimit(RateLimitPolicy policy) {
            this.defaultRateLimit = policy;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(DispatchObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public EventRouter build() {
            return new EventRouter(this);
        }
    }
}
