package com.questrail.steward.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.steward.dispatch.internal.time.WallClock;
import com.questrail.steward.model.EventType;
import com.questrail.steward.model.InboundEvent;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * InboundEventCodec
 * -----------------------------------------------------------------------------
 * Decodes the normalized JSON event shape into {@link InboundEvent}:
 *
 * <pre>
 * {
 *   "id": "1187",
 *   "type": "button",
 *   "actorId": "u-42",
 *   "contextId": "guild-7",
 *   "discriminator": "confirm_setup_fsu_123",
 *   "permissions": ["ADMINISTRATOR"],
 *   "payload": { "reason": "..." }
 * }
 * </pre>
 *
 * {@code id}, {@code actorId} and {@code discriminator} are required. An absent
 * or unrecognised {@code type} decodes as {@link EventType#UNKNOWN}. The arrival
 * stamp comes from the supplied {@link WallClock}, not from the body.
 */
public final class InboundEventCodec {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final WallClock wallClock;

    public InboundEventCodec(WallClock wallClock) {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true), wallClock);
    }

    public InboundEventCodec(ObjectMapper mapper, WallClock wallClock) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public InboundEvent decode(byte[] body) {
        Objects.requireNonNull(body, "body");

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new EventDecodeException("Body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EventDecodeException("Body must be a JSON object");
        }

        String id = requiredText(root, "id");
        String actorId = requiredText(root, "actorId");
        String discriminator = requiredText(root, "discriminator");
        EventType type = EventType.fromWireName(optionalText(root, "type"));
        String contextId = optionalText(root, "contextId");

        return new InboundEvent(
            id,
            type,
            actorId,
            contextId,
            discriminator,
            permissions(root.get("permissions")),
            payload(root.get("payload")),
            wallClock.now());
    }

    private static String requiredText(JsonNode root, String field) {
        String value = optionalText(root, field);
        if (value == null || value.isBlank()) {
            throw new EventDecodeException("Missing required field '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual() && !node.isNumber()) {
            throw new EventDecodeException("Field '" + field + "' must be a string");
        }
        return node.asText();
    }

    private static Set<String> permissions(JsonNode node) {
        if (node == null || node.isNull()) {
            return Set.of();
        }
        if (!node.isArray()) {
            throw new EventDecodeException("Field 'permissions' must be an array");
        }
        Set<String> granted = new LinkedHashSet<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new EventDecodeException("Field 'permissions' must contain strings");
            }
            granted.add(element.asText());
        }
        return granted;
    }

    private Map<String, Object> payload(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new EventDecodeException("Field 'payload' must be an object");
        }
        try {
            Map<String, Object> values = mapper.treeToValue(node, mapper.getTypeFactory().constructType(PAYLOAD_TYPE));
            values.values().removeIf(Objects::isNull);
            return values;
        } catch (JsonProcessingException e) {
            throw new EventDecodeException("Field 'payload' could not be read", e);
        }
    }
}
