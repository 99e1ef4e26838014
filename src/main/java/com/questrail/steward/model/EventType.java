package com.questrail.steward.model;

import java.util.Locale;

/**
 * Kind of inbound interaction. Determines how the discriminator is routed:
 * commands match exactly, buttons and forms match by ordered prefix.
 */
public enum EventType {
    COMMAND,
    BUTTON,
    FORM,
    UNKNOWN;

    /**
     * Parses a wire name ({@code "command"}, {@code "button"}, {@code "form"}).
     * Anything unrecognised, including {@code null}, is {@link #UNKNOWN}.
     */
    public static EventType fromWireName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "command":
                return COMMAND;
            case "button":
                return BUTTON;
            case "form":
                return FORM;
            default:
                return UNKNOWN;
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
