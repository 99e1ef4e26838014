package com.questrail.steward.channel;

/**
 * Tagged failure reported by the remote channel.
 *
 * <p>The dispatch core branches on this tag, never on platform error codes.
 * Mapping codes to tags is the channel client's job.</p>
 */
public enum ChannelError {
    /** The acknowledgment deadline (or token lifetime) elapsed; the exchange is dead. */
    EXPIRED,
    /** The remote side already considers the event acknowledged. */
    ALREADY_ACKED,
    PERMISSION_DENIED,
    UNKNOWN;

    /**
     * Races and timeouts that the core absorbs without escalation.
     */
    public boolean isRecoverable() {
        return this == EXPIRED || this == ALREADY_ACKED;
    }
}
