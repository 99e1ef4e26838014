package com.questrail.steward.config;

import java.util.Objects;

/**
 * User-facing texts the dispatch core sends on its own behalf.
 */
public record DispatchMessages(
        String notAvailable,
        String unknownCommand,
        String rateLimited,
        String permissionDenied,
        String genericFailure
) {
    public DispatchMessages {
        Objects.requireNonNull(notAvailable, "notAvailable");
        Objects.requireNonNull(unknownCommand, "unknownCommand");
        Objects.requireNonNull(rateLimited, "rateLimited");
        Objects.requireNonNull(permissionDenied, "permissionDenied");
        Objects.requireNonNull(genericFailure, "genericFailure");
    }

    public static DispatchMessages defaults() {
        return new DispatchMessages(
                "❌ This action is no longer available.",
                "❌ Unknown command. It might have been removed or is not deployed correctly.",
                "⏳ You're doing that too often. Please wait a moment and try again.",
                "❌ You do not have permission to do that.",
                "❌ There was an error while processing your request!"
        );
    }
}
