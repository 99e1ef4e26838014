package com.questrail.steward.model;

import java.util.Objects;

/**
 * Content of one outbound response.
 *
 * @param content         message text
 * @param ephemeral       visible only to the actor
 * @param clearComponents strip buttons/forms from the message being answered
 */
public record ResponsePayload(String content, boolean ephemeral, boolean clearComponents) {

    public ResponsePayload {
        Objects.requireNonNull(content, "content");
    }

    public static ResponsePayload visible(String content) {
        return new ResponsePayload(content, false, false);
    }

    public static ResponsePayload ephemeral(String content) {
        return new ResponsePayload(content, true, false);
    }

    /**
     * Private message that also removes interactive affordances, so a dead
     * exchange cannot be retried from stale buttons.
     */
    public static ResponsePayload error(String content) {
        return new ResponsePayload(content, true, true);
    }
}
