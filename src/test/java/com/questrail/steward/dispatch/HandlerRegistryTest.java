package com.questrail.steward.dispatch;

import com.questrail.steward.model.EventType;
import com.questrail.steward.model.InboundEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HandlerRegistryTest
 * -----------------------------------------------------------------------------
 * Resolution order for component handlers: the first registration that matches
 * wins, so overlapping prefixes are resolved by registration order.
 */
class HandlerRegistryTest {

    private static final EventHandler NOOP = (event, responder) -> {};

    private HandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HandlerRegistry();
    }

    private static InboundEvent button(String customId) {
        return InboundEvent.button("E1", "u1", customId, Instant.EPOCH);
    }

    @Test
    void genericRegisteredFirstShadowsSpecific() {
        HandlerRegistration generic = registry.button("confirm_").handle(NOOP);
        registry.button("confirm_setup_").handle(NOOP);

        assertSame(generic, registry.resolve(button("confirm_setup_fsu_123")).orElseThrow());
        assertSame(generic, registry.resolve(button("confirm_otp_button_123")).orElseThrow());
    }

    @Test
    void specificRegisteredFirstTakesPrecedence() {
        HandlerRegistration specific = registry.button("confirm_setup_").handle(NOOP);
        HandlerRegistration generic = registry.button("confirm_").handle(NOOP);

        assertSame(specific, registry.resolve(button("confirm_setup_fsu_123")).orElseThrow());
        assertSame(generic, registry.resolve(button("confirm_otp_button_123")).orElseThrow());
    }

    @Test
    void excludedFragmentFallsThroughToLaterRegistration() {
        HandlerRegistration join = registry.button("join_club_").excluding("modal").handle(NOOP);
        HandlerRegistration modal = registry.button("join_club_modal_").handle(NOOP);

        assertSame(join, registry.resolve(button("join_club_42")).orElseThrow());
        assertSame(modal, registry.resolve(button("join_club_modal_42")).orElseThrow());
    }

    @Test
    void typeMustMatchAsWellAsDiscriminator() {
        HandlerRegistration form = registry.form("apply_").handle(NOOP);

        assertTrue(registry.resolve(button("apply_1")).isEmpty());
        assertSame(form, registry.resolve(InboundEvent.form("E2", "u1", "apply_1", Instant.EPOCH)).orElseThrow());
    }

    @Test
    void commandsResolveByExactName() {
        HandlerRegistration setup = registry.command("setup").handle(NOOP);

        assertSame(setup, registry.resolve(InboundEvent.command("E1", "u1", "setup", Instant.EPOCH)).orElseThrow());
        assertTrue(registry.resolve(InboundEvent.command("E2", "u1", "setup-extra", Instant.EPOCH)).isEmpty());
    }

    @Test
    void commandRegisteredTwiceIsRejected() {
        registry.command("setup").handle(NOOP);

        assertThrows(IllegalArgumentException.class, () -> registry.command("setup").handle(NOOP));
    }

    @Test
    void commandsRequireExactMatcher() {
        assertThrows(IllegalArgumentException.class, () ->
            registry.register(EnumSet.of(EventType.COMMAND), DiscriminatorMatcher.prefix("set"), NOOP));
    }

    @Test
    void unknownEventsCannotBeRegistered() {
        assertThrows(IllegalArgumentException.class, () ->
            registry.register(EnumSet.of(EventType.UNKNOWN), DiscriminatorMatcher.prefix("x"), NOOP));
    }

    @Test
    void sealedRegistryRefusesRegistration() {
        registry.button("a_").handle(NOOP);
        registry.seal();

        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class, () -> registry.button("b_").handle(NOOP));
        assertEquals(1, registry.size());
    }

    @Test
    void defaultActionNamesKindAndPattern() {
        assertEquals("button:confirm_*", registry.button("confirm_").handle(NOOP).action());
        assertEquals("command:setup", registry.command("setup").handle(NOOP).action());
        assertEquals("apply", registry.form("apply_").as("apply").handle(NOOP).action());
    }

    @Test
    void emptyPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DiscriminatorMatcher.prefix(""));
    }

    @Test
    void unsealedRegistryCanBeReadWhileRegistering() throws InterruptedException {
        registry.button("stable_").handle(NOOP);
        AtomicReference<Throwable> readerFailure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread reader = new Thread(() -> {
            try {
                while (done.getCount() > 0) {
                    registry.resolve(button("absent_1"));
                    assertTrue(registry.resolve(button("stable_1")).isPresent());
                }
            } catch (Throwable t) {
                readerFailure.set(t);
            }
        });
        reader.start();
        try {
            for (int i = 0; i < 5_000; i++) {
                registry.button("late_" + i + "_").handle(NOOP);
            }
        } finally {
            done.countDown();
            reader.join(5_000);
        }

        assertNull(readerFailure.get(), () -> "resolve failed during registration: " + readerFailure.get());
    }
}
