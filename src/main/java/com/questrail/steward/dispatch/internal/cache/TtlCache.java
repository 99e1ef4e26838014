package com.questrail.steward.dispatch.internal.cache;

import com.questrail.steward.dispatch.internal.time.Cancellable;
import com.questrail.steward.dispatch.internal.time.MonotonicClock;
import com.questrail.steward.dispatch.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * TtlCache
 * =============================================================================
 * Process-local key/value store with two kinds of entries.
 *
 * <h2>Timed entries</h2>
 * Inserted with {@link #put(Object, Object, Duration)}. Each insertion schedules
 * its own expiry on the {@link MonotonicScheduler}; there is no background scan,
 * so memory is bounded by the number of live entries. An expiry only removes the
 * exact entry it was scheduled for, never a later re-insertion under the same key.
 *
 * <h2>Untimed entries</h2>
 * Created by {@link #compute(Object, Supplier, Function)} and kept until a caller
 * runs {@link #sweep(Duration)}. Every compute or {@link #touch(Object)} refreshes
 * the entry's last-activity tick; a sweep drops untimed entries idle for at least
 * the given duration. Timed entries are never swept.
 *
 * <h2>Thread Safety</h2>
 * Safe for concurrent use. {@code compute} and sweep removal of the same key are
 * atomic with respect to each other.
 */
public final class TtlCache<K, V> {

    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public TtlCache(MonotonicClock clock, MonotonicScheduler scheduler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Inserts a timed entry if the key is absent.
     *
     * @return {@code true} if newly inserted; {@code false} if the key was
     *         already present, in which case nothing changes
     */
    public boolean put(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");

        Entry<V> fresh = new Entry<>(value, clock.nowNanos(), true);
        if (entries.putIfAbsent(key, fresh) != null) {
            return false;
        }
        fresh.expiry = scheduler.scheduleAfter(ttl, clock, () -> entries.remove(key, fresh));
        return true;
    }

    /**
     * Runs {@code action} against the untimed entry for {@code key}, creating it
     * with {@code factory} if absent, and refreshes its last-activity tick.
     *
     * <p>The action runs while the key is locked. It must be short and must not
     * touch this cache.</p>
     */
    public <R> R compute(K key, Supplier<? extends V> factory, Function<? super V, ? extends R> action) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(action, "action");

        AtomicReference<R> result = new AtomicReference<>();
        entries.compute(key, (k, existing) -> {
            long now = clock.nowNanos();
            Entry<V> entry = existing != null ? existing : new Entry<>(factory.get(), now, false);
            entry.touchedNanos = now;
            result.set(action.apply(entry.value));
            return entry;
        });
        return result.get();
    }

    public Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    /**
     * Records activity on an existing entry without changing its value.
     *
     * @return {@code false} if the key is absent
     */
    public boolean touch(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return false;
        }
        entry.touchedNanos = clock.nowNanos();
        return true;
    }

    /**
     * Drops untimed entries whose last activity is at least {@code idle} ago.
     *
     * @return number of entries removed
     */
    public int sweep(Duration idle) {
        Objects.requireNonNull(idle, "idle");
        long idleNanos = idle.toNanos();
        long now = clock.nowNanos();

        int[] removed = {0};
        for (K key : entries.keySet()) {
            entries.computeIfPresent(key, (k, entry) -> {
                if (!entry.timed && now - entry.touchedNanos >= idleNanos) {
                    removed[0]++;
                    return null;
                }
                return entry;
            });
        }
        return removed[0];
    }

    /**
     * Removes an entry early, cancelling its expiry timer if it has one.
     */
    public boolean remove(K key) {
        Entry<V> entry = entries.remove(key);
        if (entry == null) {
            return false;
        }
        entry.cancelExpiry();
        return true;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Removes everything and cancels all pending expiries.
     */
    public void clear() {
        for (K key : entries.keySet()) {
            remove(key);
        }
    }

    private static final class Entry<V> {
        private final V value;
        private final boolean timed;
        private volatile long touchedNanos;
        private volatile Cancellable expiry;

        private Entry(V value, long nowNanos, boolean timed) {
            this.value = value;
            this.touchedNanos = nowNanos;
            this.timed = timed;
        }

        private void cancelExpiry() {
            Cancellable handle = expiry;
            if (handle != null) {
                handle.cancel();
            }
        }
    }
}
