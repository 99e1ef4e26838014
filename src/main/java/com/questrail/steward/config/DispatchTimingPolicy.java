package com.questrail.steward.config;

import java.time.Duration;
import java.util.Objects;

/**
 * DispatchTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the dispatch core.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>dedupTtl</b>: How long an event id is remembered after first sight.
 *       A redelivery after this window is treated as a new event.</li>
 *   <li><b>ackDeadline</b>: The platform's acknowledgment window. It is imposed
 *       remotely; the core only uses it to arm a diagnostic watchdog.</li>
 *   <li><b>deferredResponseWindow</b>: How long after a deferral the exchange
 *       still accepts edits and follow-ups. Past it, responses are suppressed.</li>
 *   <li><b>sweepProbability</b>: Chance per rate-limit check of sweeping stale
 *       windows out of the limiter's cache.</li>
 * </ul>
 */
public record DispatchTimingPolicy(
        Duration dedupTtl,
        Duration ackDeadline,
        Duration deferredResponseWindow,
        double sweepProbability
) {
    public DispatchTimingPolicy {
        Objects.requireNonNull(dedupTtl, "dedupTtl");
        Objects.requireNonNull(ackDeadline, "ackDeadline");
        Objects.requireNonNull(deferredResponseWindow, "deferredResponseWindow");

        if (dedupTtl.isNegative() || dedupTtl.isZero()) {
            throw new IllegalArgumentException("dedupTtl must be positive");
        }
        if (ackDeadline.isNegative()) {
            throw new IllegalArgumentException("ackDeadline must be non-negative");
        }
        if (deferredResponseWindow.isNegative()) {
            throw new IllegalArgumentException("deferredResponseWindow must be non-negative");
        }
        if (!(sweepProbability >= 0.0 && sweepProbability <= 1.0)) {
            throw new IllegalArgumentException("sweepProbability must be within [0, 1]");
        }
    }

    /**
     * Defaults observed on the target platform:
     * <ul>
     *   <li>dedupTtl: 30s</li>
     *   <li>ackDeadline: 3s</li>
     *   <li>deferredResponseWindow: 15min</li>
     *   <li>sweepProbability: 0.01</li>
     * </ul>
     */
    public static DispatchTimingPolicy defaults() {
        return new DispatchTimingPolicy(
                Duration.ofSeconds(30),
                Duration.ofSeconds(3),
                Duration.ofMinutes(15),
                0.01
        );
    }

    public DispatchTimingPolicy withDedupTtl(Duration ttl) {
        return new DispatchTimingPolicy(ttl, ackDeadline, deferredResponseWindow, sweepProbability);
    }

    public DispatchTimingPolicy withSweepProbability(double probability) {
        return new DispatchTimingPolicy(dedupTtl, ackDeadline, deferredResponseWindow, probability);
    }
}
