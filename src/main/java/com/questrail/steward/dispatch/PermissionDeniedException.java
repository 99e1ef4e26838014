package com.questrail.steward.dispatch;

/**
 * Thrown by a handler that detects, before any side effect, that the actor may
 * not perform the action. The router answers with this exception's message
 * instead of a generic failure.
 */
public final class PermissionDeniedException extends RuntimeException
{
    public PermissionDeniedException(String message) {
        super(message);
    }
}
