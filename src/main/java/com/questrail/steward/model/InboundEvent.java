package com.questrail.steward.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * InboundEvent
 * -----------------------------------------------------------------------------
 * One normalized external request that expects at most one terminal response.
 *
 * <p>Created by the connection layer on arrival and never persisted. The
 * {@code arrivedAt} stamp is wall-clock and observational only; deadlines are
 * measured on the dispatch core's monotonic clock.</p>
 *
 * @param id            platform-assigned event id, the dedup key
 * @param type          interaction kind
 * @param actorId       user who triggered the event
 * @param contextId     guild/channel scope the event came from
 * @param discriminator command name or button/form custom id
 * @param permissions   permissions granted to the actor in {@code contextId}
 * @param payload       decoded options or form values
 * @param arrivedAt     observational arrival time
 */
public record InboundEvent(
        String id,
        EventType type,
        String actorId,
        String contextId,
        String discriminator,
        Set<String> permissions,
        Map<String, Object> payload,
        Instant arrivedAt
) {
    public InboundEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(discriminator, "discriminator");
        Objects.requireNonNull(arrivedAt, "arrivedAt");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        contextId = contextId == null ? "" : contextId;
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }

    public static InboundEvent command(String id, String actorId, String name, Instant arrivedAt) {
        return new InboundEvent(id, EventType.COMMAND, actorId, "", name, Set.of(), Map.of(), arrivedAt);
    }

    public static InboundEvent button(String id, String actorId, String customId, Instant arrivedAt) {
        return new InboundEvent(id, EventType.BUTTON, actorId, "", customId, Set.of(), Map.of(), arrivedAt);
    }

    public static InboundEvent form(String id, String actorId, String customId, Instant arrivedAt) {
        return new InboundEvent(id, EventType.FORM, actorId, "", customId, Set.of(), Map.of(), arrivedAt);
    }

    public InboundEvent withPermissions(Set<String> granted) {
        return new InboundEvent(id, type, actorId, contextId, discriminator, granted, payload, arrivedAt);
    }
}
