package com.questrail.steward.dispatch;

import com.questrail.steward.channel.DeferMode;
import com.questrail.steward.dispatch.internal.admission.RateLimitPolicy;
import com.questrail.steward.model.EventType;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable binding of (event types, discriminator matcher) to a handler,
 * plus its admission options.
 *
 * @param action             rate-limit key for this binding
 * @param rateLimit          per-(actor, action) limit; null to use the runtime default
 * @param autoDefer          deferral issued before the handler runs; null for none
 * @param requiredPermission permission the actor must hold; null for none
 */
public record HandlerRegistration(
        Set<EventType> types,
        DiscriminatorMatcher matcher,
        EventHandler handler,
        String action,
        RateLimitPolicy rateLimit,
        DeferMode autoDefer,
        String requiredPermission
) {
    public HandlerRegistration {
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(action, "action");
        if (types.isEmpty()) {
            throw new IllegalArgumentException("at least one event type required");
        }
        if (types.contains(EventType.UNKNOWN)) {
            throw new IllegalArgumentException("UNKNOWN events cannot be routed");
        }
        if (types.contains(EventType.COMMAND) && matcher.exactValue().isEmpty()) {
            throw new IllegalArgumentException("commands match by exact name, got " + matcher.describe());
        }
        types = Set.copyOf(EnumSet.copyOf(types));
    }

    public boolean accepts(EventType type, String discriminator) {
        return types.contains(type) && matcher.matches(discriminator);
    }

    public Optional<RateLimitPolicy> rateLimitPolicy() {
        return Optional.ofNullable(rateLimit);
    }

    public Optional<DeferMode> autoDeferMode() {
        return Optional.ofNullable(autoDefer);
    }

    public Optional<String> permission() {
        return Optional.ofNullable(requiredPermission);
    }
}
