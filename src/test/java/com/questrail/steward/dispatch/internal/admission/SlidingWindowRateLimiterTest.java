package com.questrail.steward.dispatch.internal.admission;

import com.questrail.steward.dispatch.internal.cache.TtlCache;
import com.questrail.steward.time.DeterministicScheduler;
import com.questrail.steward.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowRateLimiterTest {

    private ManualMonotonicClock clock;
    private TtlCache<SlidingWindowRateLimiter.WindowKey, SlidingWindowRateLimiter.Window> windows;
    private SlidingWindowRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        windows = new TtlCache<>(clock, new DeterministicScheduler(clock));
        limiter = new SlidingWindowRateLimiter(windows, clock, 0.0);
    }

    @Test
    void fiveInAMinuteThenRejectedUntilWindowSlides() {
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.allow("u1", "apply", 5, 60_000), "call " + (i + 1) + " at t=0");
        }

        clock.advanceMillis(100);
        assertFalse(limiter.allow("u1", "apply", 5, 60_000), "6th call at t=100");

        clock.advanceMillis(60_900);
        assertTrue(limiter.allow("u1", "apply", 5, 60_000), "call at t=61000");
    }

    @Test
    void rejectedCallsDoNotConsumeCapacity() {
        limiter.allow("u1", "a", 1, 1_000);
        for (int i = 0; i < 10; i++) {
            assertFalse(limiter.allow("u1", "a", 1, 1_000));
        }

        clock.advanceMillis(1_000);
        assertTrue(limiter.allow("u1", "a", 1, 1_000));
    }

    @Test
    void windowsAreKeyedByActorAndAction() {
        assertTrue(limiter.allow("u1", "a", 1, 60_000));
        assertFalse(limiter.allow("u1", "a", 1, 60_000));

        assertTrue(limiter.allow("u2", "a", 1, 60_000));
        assertTrue(limiter.allow("u1", "b", 1, 60_000));
        assertEquals(3, limiter.trackedWindows());
    }

    @Test
    void policyOverloadUsesLimitAndWindow() {
        RateLimitPolicy policy = RateLimitPolicy.of(2, Duration.ofSeconds(10));

        assertTrue(limiter.allow("u1", "a", policy));
        assertTrue(limiter.allow("u1", "a", policy));
        assertFalse(limiter.allow("u1", "a", policy));
    }

    @Test
    void probabilisticSweepDropsIdleWindows() {
        AtomicInteger draws = new AtomicInteger();
        // First draw misses, every later draw hits.
        SlidingWindowRateLimiter sweeping = new SlidingWindowRateLimiter(
            windows, clock, 0.5, () -> draws.getAndIncrement() == 0 ? 0.9 : 0.1);

        sweeping.allow("idle", "a", 3, 1_000);
        assertEquals(1, sweeping.trackedWindows());

        clock.advanceMillis(1_000);
        sweeping.allow("fresh", "a", 3, 1_000);

        assertEquals(1, sweeping.trackedWindows());
        assertTrue(windows.get(new SlidingWindowRateLimiter.WindowKey("fresh", "a")).isPresent());
    }

    @Test
    void concurrentCallersNeverExceedLimit() throws InterruptedException {
        int threads = 8;
        int attemptsPerThread = 50;
        AtomicInteger admitted = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < attemptsPerThread; i++) {
                            if (limiter.allow("u1", "burst", 25, 60_000)) {
                                admitted.incrementAndGet();
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(25, admitted.get());
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> limiter.allow("u", "a", 0, 1_000));
        assertThrows(IllegalArgumentException.class, () -> limiter.allow("u", "a", 1, 0));
        assertThrows(IllegalArgumentException.class, () -> RateLimitPolicy.of(1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> new SlidingWindowRateLimiter(windows, clock, 1.5));
    }
}
