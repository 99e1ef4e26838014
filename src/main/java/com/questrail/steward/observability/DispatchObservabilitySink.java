package com.questrail.steward.observability;

/**
 * Main interface for receiving dispatch-core observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Components never log directly; everything diagnostic flows through here.
 * Implementations must be thread-safe: handler threads, the intake thread and
 * timer threads all report into the same sink.</p>
 */
public interface DispatchObservabilitySink {

    /**
     * Called when an event is stopped before its handler runs.
     */
    void onRejected(DispatchRejectedEvent event);

    /**
     * Called when an event's acknowledgment phase advances.
     */
    void onAckTransition(AckTransitionEvent event);

    /**
     * Called when an outbound primitive fails, recovered or not.
     */
    void onChannelFailure(ChannelFailureEvent event);

    /**
     * Called when a response is deliberately not attempted.
     */
    void onResponseSuppressed(ResponseSuppressedEvent event);

    /**
     * Called when the acknowledgment deadline passes with nothing acknowledged.
     */
    void onAckDeadlineMissed(AckDeadlineMissedEvent event);

    /**
     * Called when a handler fault is caught at the router boundary.
     */
    void onHandlerFault(HandlerFaultEvent event);

    /**
     * Called once per invoked handler after dispatch finishes.
     */
    void onDispatchCompleted(DispatchCompletedEvent event);

    /**
     * Called when the dispatch machinery itself fails, or when a last-resort
     * response could not be delivered.
     */
    void onError(DispatchErrorEvent event);
}
