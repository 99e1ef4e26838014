package com.questrail.steward.transport.http;

/**
 * Indicates that a request body could not be translated into an
 * {@link com.questrail.steward.model.InboundEvent}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Invalid JSON</li>
 *   <li>A missing or blank required field</li>
 *   <li>A field of the wrong JSON type</li>
 * </ul>
 */
public final class EventDecodeException extends RuntimeException
{
    public EventDecodeException(String message) {
        super(message);
    }

    public EventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
