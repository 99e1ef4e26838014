package com.questrail.steward.dispatch.internal.ack;

import com.questrail.steward.dispatch.internal.time.Cancellable;
import com.questrail.steward.dispatch.internal.time.MonotonicClock;
import com.questrail.steward.dispatch.internal.time.MonotonicScheduler;
import com.questrail.steward.dispatch.internal.time.WallClock;
import com.questrail.steward.observability.AckDeadlineMissedEvent;
import com.questrail.steward.observability.DispatchObservabilitySink;
import com.questrail.steward.observability.NullDispatchObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * Arms one timer per dispatched event at the platform's acknowledgment
 * deadline. If the event is still {@link AckPhase#UNACKED} when it fires, the
 * miss is reported. The watchdog never cancels or answers anything; the
 * deadline itself is enforced remotely.
 */
public final class AckDeadlineWatchdog {

    private static final Cancellable DISARMED = () -> false;

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration deadline;
    private final DispatchObservabilitySink observabilitySink;

    public AckDeadlineWatchdog(MonotonicScheduler scheduler,
                               MonotonicClock clock,
                               WallClock wallClock,
                               Duration deadline,
                               DispatchObservabilitySink observabilitySink)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullDispatchObservabilitySink.INSTANCE);
    }

    /**
     * @return handle the caller cancels when dispatch of the event completes
     */
    public Cancellable arm(AckState state) {
        Objects.requireNonNull(state, "state");
        if (deadline.isZero()) {
            return DISARMED;
        }
        return scheduler.scheduleAfter(deadline, clock, () -> onDeadline(state));
    }

    private void onDeadline(AckState state) {
        if (state.phase() == AckPhase.UNACKED && !state.isUnreachable()) {
            observabilitySink.onAckDeadlineMissed(new AckDeadlineMissedEvent(
                wallClock.now(), state.event().id(), state.event().discriminator(), deadline));
        }
    }
}
