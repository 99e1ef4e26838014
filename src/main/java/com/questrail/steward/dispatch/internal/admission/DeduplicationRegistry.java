package com.questrail.steward.dispatch.internal.admission;

import com.questrail.steward.dispatch.internal.cache.TtlCache;

import java.time.Duration;
import java.util.Objects;

/**
 * DeduplicationRegistry
 * -----------------------------------------------------------------------------
 * At-most-once guard per event id, built on a {@link TtlCache}.
 *
 * <p>This is a best-effort, in-memory guard. An id is remembered for a fixed
 * TTL after first sight; a redelivery after that window is treated as a new
 * event. State does not survive a restart.</p>
 */
public final class DeduplicationRegistry {

    private final TtlCache<String, DedupEntry> entries;
    private final Duration ttl;

    public DeduplicationRegistry(TtlCache<String, DedupEntry> entries, Duration ttl) {
        this.entries = Objects.requireNonNull(entries, "entries");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * @return {@code false} on first sight (the id is now recorded);
     *         {@code true} if the id is a duplicate, in which case nothing changes
     */
    public boolean seen(String eventId) {
        Objects.requireNonNull(eventId, "eventId");
        return !entries.put(eventId, new DedupEntry(eventId), ttl);
    }

    /**
     * Flags a remembered id as fully handled. No effect if it already expired.
     */
    public void markHandled(String eventId) {
        entries.get(eventId).ifPresent(DedupEntry::markHandled);
    }

    public boolean isHandled(String eventId) {
        return entries.get(eventId).map(DedupEntry::handled).orElse(false);
    }

    /**
     * Number of ids currently remembered.
     */
    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * One remembered event id.
     */
    public static final class DedupEntry {
        private final String eventId;
        private volatile boolean handled;

        DedupEntry(String eventId) {
            this.eventId = eventId;
        }

        public String eventId() {
            return eventId;
        }

        public boolean handled() {
            return handled;
        }

        void markHandled() {
            handled = true;
        }
    }
}
