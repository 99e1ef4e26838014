package com.questrail.steward.transport.http;

import com.questrail.steward.dispatch.EventDispatchDriver;
import com.questrail.steward.dispatch.internal.time.WallClock;
import com.questrail.steward.model.InboundEvent;
import com.questrail.steward.observability.DispatchErrorEvent;
import com.questrail.steward.observability.DispatchObservabilitySink;
import com.questrail.steward.observability.NullDispatchObservabilitySink;
import com.questrail.steward.transport.EventEndpoint;
import com.questrail.steward.transport.EventEndpointListener;
import com.questrail.steward.transport.IngressVerdict;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * HttpEventIngress
 * =============================================================================
 * Translation layer between an {@link EventEndpoint} and the dispatch driver.
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 * <pre>
 *   EventEndpoint
 *        → InboundEventCodec
 *            → EventDispatchDriver.submitEvent
 *                → EventRouter
 * </pre>
 *
 * Malformed bodies are refused here and never reach the router. This class
 * adds no retries, timing or acknowledgment logic.
 */
public final class HttpEventIngress implements EventEndpointListener {

    private final EventEndpoint endpoint;
    private final InboundEventCodec codec;
    private final EventDispatchDriver driver;
    private final WallClock wallClock;
    private final DispatchObservabilitySink observabilitySink;

    private volatile boolean up;

    public HttpEventIngress(EventEndpoint endpoint,
                            InboundEventCodec codec,
                            EventDispatchDriver driver,
                            WallClock wallClock,
                            DispatchObservabilitySink observabilitySink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullDispatchObservabilitySink.INSTANCE);

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isUp() {
        return up;
    }

    public InetSocketAddress localAddress() {
        return endpoint.localAddress();
    }

    // -------------------------------------------------------------------------
    // EventEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onEndpointUp() {
        up = true;
    }

    @Override
    public void onEndpointDown(Throwable cause) {
        up = false;
        if (cause != null) {
            observabilitySink.onError(new DispatchErrorEvent(wallClock.now(), "Ingress endpoint went down", cause));
        }
    }

    @Override
    public IngressVerdict onEventPayload(SocketAddress remote, byte[] body) {
        InboundEvent event;
        try {
            event = codec.decode(body);
        } catch (EventDecodeException e) {
            return IngressVerdict.malformed(e.getMessage());
        }

        if (!driver.submitEvent(event)) {
            return IngressVerdict.unavailable("dispatcher is not running");
        }
        return IngressVerdict.accepted();
    }
}
