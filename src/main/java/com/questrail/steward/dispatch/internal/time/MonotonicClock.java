package com.questrail.steward.dispatch.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every admission and expiry decision in the dispatch core.
 *
 * <h2>Binding invariant</h2>
 * Dedup lifetimes, sliding rate-limit windows and acknowledgment deadlines MUST
 * be computed from a monotonic source. Wall-clock time ({@code Instant.now()})
 * is permitted only for observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
