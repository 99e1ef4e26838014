package com.questrail.steward.dispatch;

/**
 * How {@link EventRouter#dispatch} disposed of one event.
 */
public enum DispatchOutcome {
    /** Already seen within the dedup window; nothing ran, nothing was sent. */
    DUPLICATE,
    /** No registration matched; the actor was told the action is unavailable. */
    UNROUTED,
    /** Over the rate limit; the handler never ran. */
    RATE_LIMITED,
    /** The actor lacks a required permission; rejected before any side effect. */
    FORBIDDEN,
    /** The handler returned normally. */
    HANDLED,
    /** The handler raised; a generic failure was sent. */
    FAILED
}
