package com.questrail.steward.observability;

import java.time.Instant;

/**
 * Record representing an error in the dispatch machinery itself (not a handler fault).
 */
public record DispatchErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
