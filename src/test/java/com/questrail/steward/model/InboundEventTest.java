package com.questrail.steward.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InboundEventTest {

    @Test
    void wireNamesAreCaseInsensitiveAndUnrecognisedIsUnknown() {
        assertEquals(EventType.COMMAND, EventType.fromWireName("command"));
        assertEquals(EventType.BUTTON, EventType.fromWireName(" Button "));
        assertEquals(EventType.FORM, EventType.fromWireName("FORM"));
        assertEquals(EventType.UNKNOWN, EventType.fromWireName("autocomplete"));
        assertEquals(EventType.UNKNOWN, EventType.fromWireName(null));
        assertEquals("button", EventType.BUTTON.wireName());
    }

    @Test
    void collectionsAreCopiedAndDefaulted() {
        Set<String> granted = new HashSet<>(Set.of("ADMINISTRATOR"));
        InboundEvent event = new InboundEvent("E1", EventType.COMMAND, "u1", null, "setup",
            granted, null, Instant.EPOCH);
        granted.clear();

        assertTrue(event.hasPermission("ADMINISTRATOR"));
        assertEquals("", event.contextId());
        assertEquals(Map.of(), event.payload());
    }

    @Test
    void blankIdIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> InboundEvent.command(" ", "u1", "setup", Instant.EPOCH));
    }

    @Test
    void formNeedsAField() {
        assertThrows(IllegalArgumentException.class, () -> new FormSpec("f", "Title", List.of()));
    }
}
