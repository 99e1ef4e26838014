package com.questrail.steward.observability;

/**
 * No-op implementation of DispatchObservabilitySink.
 */
public final class NullDispatchObservabilitySink implements DispatchObservabilitySink {
    public static final NullDispatchObservabilitySink INSTANCE = new NullDispatchObservabilitySink();

    private NullDispatchObservabilitySink() {}

    @Override
    public void onRejected(DispatchRejectedEvent event) {}

    @Override
    public void onAckTransition(AckTransitionEvent event) {}

    @Override
    public void onChannelFailure(ChannelFailureEvent event) {}

    @Override
    public void onResponseSuppressed(ResponseSuppressedEvent event) {}

    @Override
    public void onAckDeadlineMissed(AckDeadlineMissedEvent event) {}

    @Override
    public void onHandlerFault(HandlerFaultEvent event) {}

    @Override
    public void onDispatchCompleted(DispatchCompletedEvent event) {}

    @Override
    public void onError(DispatchErrorEvent event) {}
}
