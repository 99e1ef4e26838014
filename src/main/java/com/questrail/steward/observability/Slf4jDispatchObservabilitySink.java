package com.questrail.steward.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Production implementation of DispatchObservabilitySink that emits logs via SLF4J.
 *
 * <p>Duplicates and admission rejections log at INFO. Recovered channel races,
 * suppressed responses and exchanges where the actor saw nothing log at WARN.
 * Handler faults and failed fallbacks log at ERROR; faults of class
 * {@code UNKNOWN} also carry the {@link #OPERATOR_REVIEW} marker.</p>
 */
public final class Slf4jDispatchObservabilitySink implements DispatchObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDispatchObservabilitySink.class);

    public static final Marker OPERATOR_REVIEW = MarkerFactory.getMarker("OPERATOR_REVIEW");

    @Override
    public void onRejected(DispatchRejectedEvent event) {
        switch (event.outcome()) {
            case UNROUTED -> log.warn("No handler for '{}' (event {}, actor {})",
                event.discriminator(), event.eventId(), event.actorId());
            case DUPLICATE -> log.info("Duplicate event {} ignored ('{}', actor {})",
                event.eventId(), event.discriminator(), event.actorId());
            default -> log.info("Event {} rejected: {} ('{}', actor {})",
                event.eventId(), event.outcome(), event.discriminator(), event.actorId());
        }
    }

    @Override
    public void onAckTransition(AckTransitionEvent event) {
        log.debug("Event {}: {} -> {} via {}",
            event.eventId(), event.from(), event.to(), event.trigger());
    }

    @Override
    public void onChannelFailure(ChannelFailureEvent event) {
        if (event.recovered()) {
            log.warn("Event {}: {} failed with {} (absorbed): {}",
                event.eventId(), event.operation(), event.error(), describe(event.cause()));
        }
        else {
            log.error("Event {}: {} failed with {}",
                event.eventId(), event.operation(), event.error(), event.cause());
        }
    }

    @Override
    public void onResponseSuppressed(ResponseSuppressedEvent event) {
        log.warn("Event {}: {} suppressed: {}", event.eventId(), event.attempted(), event.reason());
    }

    @Override
    public void onAckDeadlineMissed(AckDeadlineMissedEvent event) {
        log.warn("Event {} ('{}') still unacknowledged after {} ms; the actor will see a timeout",
            event.eventId(), event.discriminator(), event.deadline().toMillis());
    }

    @Override
    public void onHandlerFault(HandlerFaultEvent event) {
        if (event.failureClass().requiresOperatorReview()) {
            log.error(OPERATOR_REVIEW, "Handler '{}' failed for event {} (actor {}, {} ms, {})",
                event.discriminator(), event.eventId(), event.actorId(),
                event.elapsed().toMillis(), event.failureClass(), event.cause());
        }
        else {
            log.error("Handler '{}' failed for event {} (actor {}, {} ms, {})",
                event.discriminator(), event.eventId(), event.actorId(),
                event.elapsed().toMillis(), event.failureClass(), event.cause());
        }
    }

    @Override
    public void onDispatchCompleted(DispatchCompletedEvent event) {
        if (event.actorObservedNothing()) {
            log.warn("Event {} ('{}', actor {}) finished {} in {} ms but the actor observed no response (phase {}, defer {}, unreachable={})",
                event.eventId(), event.discriminator(), event.actorId(), event.outcome(),
                event.elapsed().toMillis(), event.finalPhase(), event.deferMode(), event.unreachable());
        }
        else {
            log.debug("Event {} ('{}') finished {} in {} ms",
                event.eventId(), event.discriminator(), event.outcome(), event.elapsed().toMillis());
        }
    }

    @Override
    public void onError(DispatchErrorEvent event) {
        log.error("Dispatch error: {}", event.message(), event.cause());
    }

    private static String describe(Throwable cause) {
        return cause == null ? "-" : cause.getMessage();
    }
}
