package com.questrail.steward.dispatch.internal.admission;

import com.questrail.steward.dispatch.internal.cache.TtlCache;
import com.questrail.steward.dispatch.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * SlidingWindowRateLimiter
 * =============================================================================
 * Admission control per (actor, action) over a true sliding window.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Look up the admitted-timestamp window for (actor, action).</li>
 *   <li>Drop timestamps at least {@code window} old.</li>
 *   <li>If {@code limit} timestamps remain, reject without recording.</li>
 *   <li>Otherwise record now and admit.</li>
 * </ol>
 * Rejections neither reset nor extend a window.
 *
 * <h2>Memory</h2>
 * Windows are untimed {@link TtlCache} entries. Each call sweeps the cache with
 * a small fixed probability, dropping windows idle for longer than the largest
 * window ever checked. Every timestamp in such a window is already stale.
 */
public final class SlidingWindowRateLimiter {

    private final TtlCache<WindowKey, Window> windows;
    private final MonotonicClock clock;
    private final double sweepProbability;
    private final DoubleSupplier random;
    private final AtomicLong largestWindowNanos = new AtomicLong(0);

    public SlidingWindowRateLimiter(TtlCache<WindowKey, Window> windows,
                                    MonotonicClock clock,
                                    double sweepProbability)
    {
        this(windows, clock, sweepProbability, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1) deciding when to sweep
     */
    public SlidingWindowRateLimiter(TtlCache<WindowKey, Window> windows,
                                    MonotonicClock clock,
                                    double sweepProbability,
                                    DoubleSupplier random)
    {
        this.windows = Objects.requireNonNull(windows, "windows");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
        if (!(sweepProbability >= 0.0 && sweepProbability <= 1.0)) {
            throw new IllegalArgumentException("sweepProbability must be within [0, 1]");
        }
        this.sweepProbability = sweepProbability;
    }

    public boolean allow(String actorId, String action, RateLimitPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        return allow(actorId, action, policy.limit(), policy.window().toMillis());
    }

    public boolean allow(String actorId, String action, int limit, long windowMs) {
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(action, "action");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }

        long windowNanos = Duration.ofMillis(windowMs).toNanos();
        largestWindowNanos.accumulateAndGet(windowNanos, Math::max);
        maybeSweep();

        long now = clock.nowNanos();
        return windows.compute(new WindowKey(actorId, action), Window::new,
            window -> window.tryAdmit(now, windowNanos, limit));
    }

    /**
     * Number of (actor, action) windows currently held.
     */
    public int trackedWindows() {
        return windows.size();
    }

    private void maybeSweep() {
        if (sweepProbability > 0.0 && random.getAsDouble() < sweepProbability) {
            windows.sweep(Duration.ofNanos(largestWindowNanos.get()));
        }
    }

    public record WindowKey(String actorId, String action) {
    }

    /**
     * Admitted timestamps for one (actor, action), oldest first.
     * Mutated only inside {@link TtlCache#compute}, which serializes access per key.
     */
    public static final class Window {
        private final Deque<Long> admitted = new ArrayDeque<>();

        boolean tryAdmit(long nowNanos, long windowNanos, int limit) {
            while (!admitted.isEmpty() && nowNanos - admitted.peekFirst() >= windowNanos) {
                admitted.pollFirst();
            }
            if (admitted.size() >= limit) {
                return false;
            }
            admitted.addLast(nowNanos);
            return true;
        }
    }
}
