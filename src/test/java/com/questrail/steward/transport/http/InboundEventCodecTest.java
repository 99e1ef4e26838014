package com.questrail.steward.transport.http;

import com.questrail.steward.model.EventType;
import com.questrail.steward.model.InboundEvent;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InboundEventCodecTest {

    private static final Instant ARRIVED = Instant.parse("2024-05-01T12:00:00Z");

    private final InboundEventCodec codec = new InboundEventCodec(() -> ARRIVED);

    private InboundEvent decode(String json) {
        return codec.decode(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void decodesFullEvent() {
        InboundEvent event = decode("{"
            + "\"id\": \"1187\","
            + "\"type\": \"button\","
            + "\"actorId\": \"u-42\","
            + "\"contextId\": \"guild-7\","
            + "\"discriminator\": \"confirm_setup_fsu_123\","
            + "\"permissions\": [\"ADMINISTRATOR\", \"BAN_MEMBERS\"],"
            + "\"payload\": { \"reason\": \"new member\", \"count\": 3 }"
            + "}");

        assertEquals("1187", event.id());
        assertEquals(EventType.BUTTON, event.type());
        assertEquals("u-42", event.actorId());
        assertEquals("guild-7", event.contextId());
        assertEquals("confirm_setup_fsu_123", event.discriminator());
        assertEquals(Set.of("ADMINISTRATOR", "BAN_MEMBERS"), event.permissions());
        assertEquals("new member", event.payload().get("reason"));
        assertEquals(3, event.payload().get("count"));
        assertEquals(ARRIVED, event.arrivedAt());
    }

    @Test
    void optionalFieldsDefault() {
        InboundEvent event = decode("{\"id\":\"E1\",\"type\":\"command\",\"actorId\":\"u1\",\"discriminator\":\"setup\"}");

        assertEquals("", event.contextId());
        assertTrue(event.permissions().isEmpty());
        assertTrue(event.payload().isEmpty());
    }

    @Test
    void numericIdIsAccepted() {
        assertEquals("1187", decode("{\"id\":1187,\"type\":\"form\",\"actorId\":\"u1\",\"discriminator\":\"apply\"}").id());
    }

    @Test
    void missingOrUnrecognisedTypeIsUnknown() {
        assertEquals(EventType.UNKNOWN,
            decode("{\"id\":\"E1\",\"actorId\":\"u1\",\"discriminator\":\"x\"}").type());
        assertEquals(EventType.UNKNOWN,
            decode("{\"id\":\"E1\",\"type\":\"autocomplete\",\"actorId\":\"u1\",\"discriminator\":\"x\"}").type());
    }

    @Test
    void missingRequiredFieldIsRejected() {
        EventDecodeException e = assertThrows(EventDecodeException.class,
            () -> decode("{\"type\":\"button\",\"actorId\":\"u1\",\"discriminator\":\"x\"}"));
        assertTrue(e.getMessage().contains("id"));

        assertThrows(EventDecodeException.class,
            () -> decode("{\"id\":\"E1\",\"actorId\":\"  \",\"discriminator\":\"x\"}"));
    }

    @Test
    void malformedBodiesAreRejected() {
        assertThrows(EventDecodeException.class, () -> decode("{not json"));
        assertThrows(EventDecodeException.class, () -> decode("[1, 2]"));
        assertThrows(EventDecodeException.class, () -> decode(""));
        assertThrows(EventDecodeException.class,
            () -> decode("{\"id\":\"E1\",\"actorId\":\"u1\",\"discriminator\":\"x\",\"permissions\":\"ADMIN\"}"));
        assertThrows(EventDecodeException.class,
            () -> decode("{\"id\":\"E1\",\"actorId\":\"u1\",\"discriminator\":\"x\",\"payload\":[1]}"));
        assertThrows(EventDecodeException.class,
            () -> decode("{\"id\":{\"nested\":true},\"actorId\":\"u1\",\"discriminator\":\"x\"}"));
    }
}
