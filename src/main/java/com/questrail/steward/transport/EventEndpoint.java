package com.questrail.steward.transport;

import java.net.InetSocketAddress;

/**
 * EventEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a request-based inbound transport.
 *
 * <p>Implementations may be backed by Netty, the JDK HTTP server, or a test harness.</p>
 */
public interface EventEndpoint
{
    /**
     * Start the endpoint and begin accepting requests.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link EventEndpointListener#onEndpointUp()} exactly once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     */
    void stop();

    /**
     * Register the listener that receives request bodies and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(EventEndpointListener listener);

    /**
     * The bound address, or {@code null} while the endpoint is down.
     */
    InetSocketAddress localAddress();
}
