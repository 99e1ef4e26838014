package com.questrail.steward.channel;

import com.questrail.steward.model.FormSpec;
import com.questrail.steward.model.InboundEvent;
import com.questrail.steward.model.ResponsePayload;

/**
 * ResponseChannel
 * =============================================================================
 * Outbound port to the chat platform, implemented by the external channel client.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Only {@code SafeResponder} and {@code AckStateMachine} call this port.
 *       Handlers that call it directly bypass acknowledgment tracking.</li>
 *   <li>Every failure is reported as a {@link ChannelException} carrying a
 *       {@link ChannelError} tag.</li>
 *   <li>Implementations perform I/O only: no retries, no state tracking.</li>
 * </ul>
 */
public interface ResponseChannel
{
    /**
     * Minimal acknowledgment that extends the time available for the real response.
     */
    void deferAck(InboundEvent event, DeferMode mode);

    /**
     * Creates the first visible response to an unacknowledged event.
     */
    ResponseHandle openResponse(InboundEvent event, ResponsePayload payload);

    /**
     * Replaces the deferred placeholder (or, after {@link DeferMode#UPDATE},
     * the original message).
     */
    void editResponse(InboundEvent event, ResponsePayload payload);

    /**
     * Sends an additional, independent response to an already answered event.
     */
    void followUp(InboundEvent event, ResponsePayload payload);

    /**
     * Presents a form. Legal only as the opening response.
     */
    void showForm(InboundEvent event, FormSpec form);
}
