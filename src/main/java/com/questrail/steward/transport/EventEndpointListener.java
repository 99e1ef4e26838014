package com.questrail.steward.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link EventEndpoint}.
 *
 * <p>Callbacks may arrive on transport I/O threads and must return quickly.</p>
 */
public interface EventEndpointListener
{
    void onEndpointUp();

    /**
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onEndpointDown(Throwable cause);

    /**
     * Called with the complete body of one inbound request.
     *
     * @return how the endpoint should answer the request
     */
    IngressVerdict onEventPayload(SocketAddress remote, byte[] body);
}
