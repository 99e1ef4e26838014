package com.questrail.steward.dispatch.internal.admission;

import java.time.Duration;
import java.util.Objects;

/**
 * At most {@code limit} admitted actions inside any rolling {@code window}.
 */
public record RateLimitPolicy(int limit, Duration window) {

    public RateLimitPolicy {
        Objects.requireNonNull(window, "window");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static RateLimitPolicy of(int limit, Duration window) {
        return new RateLimitPolicy(limit, window);
    }
}
