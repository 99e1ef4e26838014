package com.questrail.steward.channel;

import java.util.Objects;

/**
 * Raised by a {@link ResponseChannel} when an outbound primitive fails.
 */
public final class ChannelException extends RuntimeException
{
    private final ChannelError error;

    public ChannelException(ChannelError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ChannelException(ChannelError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ChannelError error() {
        return error;
    }
}
