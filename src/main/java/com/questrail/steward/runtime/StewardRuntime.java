package com.questrail.steward.runtime;

import com.questrail.steward.channel.ResponseChannel;
import com.questrail.steward.config.DispatchTimingPolicy;
import com.questrail.steward.config.StewardRuntimeConfig;
import com.questrail.steward.dispatch.EventDispatchDriver;
import com.questrail.steward.dispatch.EventRouter;
import com.questrail.steward.dispatch.HandlerRegistry;
import com.questrail.steward.dispatch.SafeResponder;
import com.questrail.steward.dispatch.internal.ack.AckDeadlineWatchdog;
import com.questrail.steward.dispatch.internal.ack.AckStateMachine;
import com.questrail.steward.dispatch.internal.admission.DeduplicationRegistry;
import com.questrail.steward.dispatch.internal.admission.SlidingWindowRateLimiter;
import com.questrail.steward.dispatch.internal.cache.TtlCache;
import com.questrail.steward.dispatch.internal.time.MonotonicClock;
import com.questrail.steward.dispatch.internal.time.MonotonicScheduler;
import com.questrail.steward.dispatch.internal.time.ScheduledExecutorScheduler;
import com.questrail.steward.dispatch.internal.time.SystemMonotonicClock;
import com.questrail.steward.dispatch.internal.time.SystemWallClock;
import com.questrail.steward.dispatch.internal.time.WallClock;
import com.questrail.steward.model.InboundEvent;
import com.questrail.steward.observability.DispatchObservabilitySink;
import com.questrail.steward.observability.NullDispatchObservabilitySink;
import com.questrail.steward.transport.EventEndpoint;
import com.questrail.steward.transport.http.HttpEventIngress;
import com.questrail.steward.transport.http.InboundEventCodec;
import com.questrail.steward.transport.http.netty.NettyHttpEventEndpoint;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * StewardRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production dispatch stack.
 *
 * <pre>
 *   NettyHttpEventEndpoint → HttpEventIngress → EventDispatchDriver
 *       → EventRouter → handlers → SafeResponder → ResponseChannel
 * </pre>
 *
 * The registry is sealed by {@link #start()}; handlers must be registered
 * through the builder.
 */
public final class StewardRuntime {
    private final HandlerRegistry registry;
    private final EventRouter router;
    private final EventDispatchDriver driver;
    private final HttpEventIngress ingress;
    private final ExecutorService handlerExecutor;
    private final ScheduledExecutorService schedulerExecutor;

    private StewardRuntime(HandlerRegistry registry,
                           EventRouter router,
                           EventDispatchDriver driver,
                           HttpEventIngress ingress,
                           ExecutorService handlerExecutor,
                           ScheduledExecutorService schedulerExecutor) {
        this.registry = registry;
        this.router = router;
        this.driver = driver;
        this.ingress = ingress;
        this.handlerExecutor = handlerExecutor;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        registry.seal();
        driver.start();
        ingress.start();
    }

    public void stop() {
        ingress.stop();
        driver.stop();
        shutdown(handlerExecutor);
        shutdown(schedulerExecutor);
    }

    /**
     * Queues an event without going through the HTTP ingress.
     *
     * @return {@code false} if the runtime is not running
     */
    public boolean submitEvent(InboundEvent event) {
        return driver.submitEvent(event);
    }

    public boolean isIngressUp() {
        return ingress.isUp();
    }

    /**
     * Bound ingress address, or {@code null} before {@link #start()}.
     */
    public InetSocketAddress localAddress() {
        return ingress.localAddress();
    }

    public EventRouter router() {
        return router;
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private StewardRuntimeConfig config = StewardRuntimeConfig.defaults();
        private ResponseChannel responseChannel;
        private HandlerRegistry registry = new HandlerRegistry();
        private DispatchObservabilitySink observabilitySink = NullDispatchObservabilitySink.INSTANCE;
        private EventEndpoint endpoint;

        public Builder withConfig(StewardRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withResponseChannel(ResponseChannel channel) {
            this.responseChannel = channel;
            return this;
        }

        public Builder withRegistry(HandlerRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Registers handlers on the builder's registry.
         */
        public Builder withHandlers(Consumer<HandlerRegistry> registrations) {
            registrations.accept(registry);
            return this;
        }

        public Builder withObservabilitySink(DispatchObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the Netty HTTP endpoint built from the config.
         */
        public Builder withEndpoint(EventEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public StewardRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(responseChannel, "responseChannel");
            Objects.requireNonNull(registry, "registry");
            DispatchObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullDispatchObservabilitySink.INSTANCE);
            DispatchTimingPolicy timing = config.timingPolicy();

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec =
                Executors.newSingleThreadScheduledExecutor(named("steward-timer"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Admission
            DeduplicationRegistry dedup = new DeduplicationRegistry(
                new TtlCache<>(clock, scheduler), timing.dedupTtl());
            SlidingWindowRateLimiter rateLimiter = new SlidingWindowRateLimiter(
                new TtlCache<>(clock, scheduler), clock, timing.sweepProbability());

            // 3. Acknowledgment
            AckStateMachine acks = new AckStateMachine(responseChannel, clock, wallClock, sink);
            AckDeadlineWatchdog watchdog = new AckDeadlineWatchdog(
                scheduler, clock, wallClock, timing.ackDeadline(), sink);
            SafeResponder responder = new SafeResponder(
                responseChannel, acks, clock, wallClock,
                timing.deferredResponseWindow(), config.messages(), sink);

            // 4. Router
            EventRouter router = EventRouter.builder()
                .withRegistry(registry)
                .withDeduplication(dedup)
                .withRateLimiter(rateLimiter)
                .withAckStateMachine(acks)
                .withWatchdog(watchdog)
                .withResponder(responder)
                .withMessages(config.messages())
                .withDefaultRateLimit(config.defaultRateLimit())
                .withClock(clock)
                .withWallClock(wallClock)
                .withObservabilitySink(sink)
                .build();

            // 5. Driver and ingress
            ExecutorService handlerExec =
                Executors.newFixedThreadPool(config.handlerThreads(), named("steward-handler"));
            EventDispatchDriver driver = new EventDispatchDriver(router, handlerExec, sink);

            EventEndpoint effectiveEndpoint = endpoint != null
                ? endpoint
                : new NettyHttpEventEndpoint(config.bindAddress(), config.ingressPath());
            HttpEventIngress ingress = new HttpEventIngress(
                effectiveEndpoint, new InboundEventCodec(wallClock), driver, wallClock, sink);

            return new StewardRuntime(registry, router, driver, ingress, handlerExec, schedulerExec);
        }

        private static ThreadFactory named(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
