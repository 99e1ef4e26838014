package com.questrail.steward.dispatch;

import com.questrail.steward.channel.DeferMode;
import com.questrail.steward.dispatch.internal.admission.RateLimitPolicy;
import com.questrail.steward.model.EventType;
import com.questrail.steward.model.InboundEvent;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * HandlerRegistry
 * =============================================================================
 * Routing table from discriminators to handlers.
 *
 * <h2>Resolution</h2>
 * <ul>
 *   <li>Commands: exact name lookup.</li>
 *   <li>Buttons and forms: ordered list of matchers, first match wins.
 *       Order is registration order, so a specific prefix must be registered
 *       before a general one that also matches its identifiers.</li>
 *   <li>{@link EventType#UNKNOWN}: never routed.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * Populated once at startup, then {@link #seal() sealed}. A sealed registry
 * is read without locking; an unsealed one may be read and written
 * concurrently.
 */
public final class HandlerRegistry {

    private final Map<String, HandlerRegistration> commands = new HashMap<>();
    private final List<HandlerRegistration> components = new ArrayList<>();
    private volatile boolean sealed;

    /**
     * Binds {@code handler} to events of the given types whose discriminator
     * matches.
     */
    public HandlerRegistration register(Set<EventType> typePattern,
                                        DiscriminatorMatcher discriminatorPattern,
                                        EventHandler handler)
    {
        return register(new HandlerRegistration(typePattern, discriminatorPattern, handler,
            defaultAction(typePattern, discriminatorPattern), null, null, null));
    }

    public synchronized HandlerRegistration register(HandlerRegistration registration) {
        Objects.requireNonNull(registration, "registration");
        if (sealed) {
            throw new IllegalStateException("registry is sealed; register handlers before start");
        }

        if (registration.types().contains(EventType.COMMAND)) {
            String name = registration.matcher().exactValue().orElseThrow();
            if (commands.containsKey(name)) {
                throw new IllegalArgumentException("command already registered: " + name);
            }
            commands.put(name, registration);
        }
        if (registration.types().contains(EventType.BUTTON) || registration.types().contains(EventType.FORM)) {
            components.add(registration);
        }
        return registration;
    }

    public Binding command(String name) {
        return new Binding(EnumSet.of(EventType.COMMAND), DiscriminatorMatcher.exact(name));
    }

    public Binding button(String prefix) {
        return new Binding(EnumSet.of(EventType.BUTTON), DiscriminatorMatcher.prefix(prefix));
    }

    public Binding form(String prefix) {
        return new Binding(EnumSet.of(EventType.FORM), DiscriminatorMatcher.prefix(prefix));
    }

    public Binding on(Set<EventType> types, DiscriminatorMatcher matcher) {
        return new Binding(types, matcher);
    }

    /**
     * Finds the handler for {@code event}. Lock-free once sealed; before that,
     * lookups are serialized with registration.
     */
    public Optional<HandlerRegistration> resolve(InboundEvent event) {
        Objects.requireNonNull(event, "event");
        if (sealed) {
            return lookup(event);
        }
        synchronized (this) {
            return lookup(event);
        }
    }

    private Optional<HandlerRegistration> lookup(InboundEvent event) {
        switch (event.type()) {
            case COMMAND:
                return Optional.ofNullable(commands.get(event.discriminator()));
            case BUTTON:
            case FORM:
                for (HandlerRegistration registration : components) {
                    if (registration.accepts(event.type(), event.discriminator())) {
                        return Optional.of(registration);
                    }
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    /**
     * Freezes the table. Further registration throws {@link IllegalStateException}.
     */
    public synchronized void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public synchronized int size() {
        return commands.size() + (int) components.stream()
            .filter(r -> !r.types().contains(EventType.COMMAND))
            .count();
    }

    private static String defaultAction(Set<EventType> types, DiscriminatorMatcher matcher) {
        String kind = types.size() == 1
            ? types.iterator().next().name().toLowerCase(Locale.ROOT)
            : "interaction";
        return kind + ":" + matcher.describe();
    }

    /**
     * Fluent builder for one registration; {@link #handle(EventHandler)} registers it.
     */
    public final class Binding {
        private final Set<EventType> types;
        private DiscriminatorMatcher matcher;
        private String action;
        private RateLimitPolicy rateLimit;
        private DeferMode autoDefer;
        private String requiredPermission;

        private Binding(Set<EventType> types, DiscriminatorMatcher matcher) {
            this.types = Objects.requireNonNull(types, "types");
            this.matcher = Objects.requireNonNull(matcher, "matcher");
        }

        /**
         * Excludes discriminators containing {@code fragment}.
         */
        public Binding excluding(String fragment) {
            this.matcher = matcher.excluding(fragment);
            return this;
        }

        /**
         * Overrides the rate-limit key. Bindings sharing a key share a window.
         */
        public Binding as(String action) {
            this.action = action;
            return this;
        }

        public Binding rateLimit(RateLimitPolicy policy) {
            this.rateLimit = policy;
            return this;
        }

        public Binding deferWith(DeferMode mode) {
            this.autoDefer = mode;
            return this;
        }

        public Binding requirePermission(String permission) {
            this.requiredPermission = permission;
            return this;
        }

        public HandlerRegistration handle(EventHandler handler) {
            String key = action != null ? action : defaultAction(types, matcher);
            return register(new HandlerRegistration(types, matcher, handler, key,
                rateLimit, autoDefer, requiredPermission));
        }
    }
}
