package com.questrail.steward.dispatch.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a single scheduled task.
 *
 * <p>
 * Every TTL cache entry and every acknowledgment watchdog owns exactly one of
 * these. Cancelling an entry's handle is how an early removal prevents a stale
 * expiry from running later.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
