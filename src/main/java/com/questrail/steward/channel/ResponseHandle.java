package com.questrail.steward.channel;

import java.util.Objects;

/**
 * Identifies a response created by {@link ResponseChannel#openResponse}.
 */
public record ResponseHandle(String responseId) {
    public ResponseHandle {
        Objects.requireNonNull(responseId, "responseId");
    }
}
