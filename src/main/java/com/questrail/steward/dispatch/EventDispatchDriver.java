package com.questrail.steward.dispatch;

import com.questrail.steward.dispatch.internal.time.SystemWallClock;
import com.questrail.steward.model.InboundEvent;
import com.questrail.steward.observability.DispatchErrorEvent;
import com.questrail.steward.observability.DispatchObservabilitySink;
import com.questrail.steward.observability.NullDispatchObservabilitySink;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * EventDispatchDriver
 * =============================================================================
 * Serialized intake loop in front of the {@link EventRouter}.
 *
 * <h2>Threading Model</h2>
 * One intake thread drains a queue in arrival order and hands each event to a
 * handler executor. A handler blocked on I/O therefore does not hold up other
 * events; events may complete out of arrival order. Same-id reentrancy is
 * excluded by the router's deduplication.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()            → starts the intake thread
 *   driver.submitEvent(...)   → enqueues an event
 *   driver.stop()             → stops intake; queued events are dropped
 * </pre>
 * The handler executor is owned by the caller.
 */
public final class EventDispatchDriver {

    private final EventRouter router;
    private final Executor handlerExecutor;
    private final DispatchObservabilitySink observabilitySink;

    private final BlockingQueue<InboundEvent> intake = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread intakeThread;

    public EventDispatchDriver(EventRouter router,
                               Executor handlerExecutor,
                               DispatchObservabilitySink observabilitySink)
    {
        this.router = Objects.requireNonNull(router, "router");
        this.handlerExecutor = Objects.requireNonNull(handlerExecutor, "handlerExecutor");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullDispatchObservabilitySink.INSTANCE);
    }

    /**
     * Starts the intake thread. Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            intakeThread = new Thread(this::runIntakeLoop, "steward-dispatch-intake");
            intakeThread.start();
        }
    }

    /**
     * Stops the intake thread and waits up to five seconds for it to exit.
     * Handlers already handed to the executor keep running.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread thread = intakeThread;
            if (thread != null) {
                thread.interrupt();
                try {
                    thread.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            intake.clear();
        }
    }

    /**
     * @return {@code false} if the driver is not running and the event was not queued
     */
    public boolean submitEvent(InboundEvent event) {
        Objects.requireNonNull(event, "event");
        if (!running.get()) {
            return false;
        }
        return intake.offer(event);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Events waiting for the intake thread.
     */
    public int pending() {
        return intake.size();
    }

    private void runIntakeLoop() {
        while (running.get()) {
            try {
                InboundEvent event = intake.take();
                if (running.get()) {
                    handOff(event);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown; the loop condition decides whether to exit.
                if (!running.get()) {
                    return;
                }
            }
        }
    }

    private void handOff(InboundEvent event) {
        try {
            handlerExecutor.execute(() -> dispatchSafely(event));
        } catch (RejectedExecutionException e) {
            observabilitySink.onError(new DispatchErrorEvent(
                SystemWallClock.INSTANCE.now(),
                "Handler executor rejected event " + event.id(),
                e));
        }
    }

    private void dispatchSafely(InboundEvent event) {
        try {
            router.dispatch(event);
        } catch (RuntimeException e) {
            observabilitySink.onError(new DispatchErrorEvent(
                SystemWallClock.INSTANCE.now(),
                "Event dispatch error for " + event.id(),
                e));
        }
    }
}
