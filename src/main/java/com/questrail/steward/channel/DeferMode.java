package com.questrail.steward.channel;

/**
 * How a deferral acknowledges an event.
 */
public enum DeferMode {
    /** Acknowledge without new content; the caller will edit the original message in place. */
    UPDATE,
    /** Acknowledge by creating a provisional response that is edited later. */
    REPLY_PLACEHOLDER
}
