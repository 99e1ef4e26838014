package com.questrail.steward.channel;

/**
 * Outbound primitives of {@link ResponseChannel}, named for diagnostics.
 */
public enum ChannelOperation {
    DEFER_ACK,
    OPEN_RESPONSE,
    EDIT_RESPONSE,
    FOLLOW_UP,
    SHOW_FORM
}
