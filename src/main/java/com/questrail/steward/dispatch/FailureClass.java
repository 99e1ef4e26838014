package com.questrail.steward.dispatch;

import com.questrail.steward.channel.ChannelError;
import com.questrail.steward.channel.ChannelException;

/**
 * Error taxonomy of the dispatch core.
 *
 * <ul>
 *   <li>{@link #DUPLICATE_EVENT}: dropped, INFO only.</li>
 *   <li>{@link #RATE_LIMITED}: one private message, handler never invoked.</li>
 *   <li>{@link #EXPIRED_CHANNEL}, {@link #ALREADY_ACKNOWLEDGED}: absorbed by
 *       the responder and the acknowledgment state machine.</li>
 *   <li>{@link #PERMISSION_DENIED}: rejected early with a specific message.</li>
 *   <li>{@link #HANDLER_FAULT}: caught at the router, one generic failure.</li>
 *   <li>{@link #UNKNOWN}: like a handler fault, flagged for operator review.
 *       Unclassified channel failures and {@link Error}s land here.</li>
 * </ul>
 */
public enum FailureClass {
    DUPLICATE_EVENT,
    RATE_LIMITED,
    EXPIRED_CHANNEL,
    ALREADY_ACKNOWLEDGED,
    PERMISSION_DENIED,
    HANDLER_FAULT,
    UNKNOWN;

    public static FailureClass of(ChannelError error) {
        switch (error) {
            case EXPIRED:
                return EXPIRED_CHANNEL;
            case ALREADY_ACKED:
                return ALREADY_ACKNOWLEDGED;
            case PERMISSION_DENIED:
                return PERMISSION_DENIED;
            default:
                return UNKNOWN;
        }
    }

    /**
     * Classifies a fault raised out of a handler.
     */
    public static FailureClass classify(Throwable failure) {
        if (failure instanceof ChannelException channelFailure) {
            return of(channelFailure.error());
        }
        if (failure instanceof PermissionDeniedException) {
            return PERMISSION_DENIED;
        }
        if (failure instanceof Error) {
            return UNKNOWN;
        }
        return HANDLER_FAULT;
    }

    public boolean requiresOperatorReview() {
        return this == UNKNOWN;
    }
}
