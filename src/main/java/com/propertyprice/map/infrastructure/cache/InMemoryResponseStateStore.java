package com.propertyprice.map.infrastructure.cache;

import com.propertyprice.map.application.port.out.ResponseStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-instance response store (in-memory, no Redis required).
 * An expired entry is dropped when it is read, and writes sweep every expired
 * entry at most once per sweep interval, so keys that are never read again do
 * not accumulate.
 */
public class InMemoryResponseStateStore implements ResponseStateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryResponseStateStore.class);

    static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration sweepInterval;
    private volatile Instant nextSweep;

    public InMemoryResponseStateStore(Clock clock) {
        this(clock, DEFAULT_SWEEP_INTERVAL);
    }

    public InMemoryResponseStateStore(Clock clock, Duration sweepInterval) {
        if (sweepInterval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must not be negative");
        }
        this.clock = clock;
        this.sweepInterval = sweepInterval;
        this.nextSweep = clock.instant();
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        Instant now = clock.instant();
        sweepIfDue(now);
        entries.put(key, new Entry(value, now.plus(ttl)));
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return type.isInstance(entry.value) ? Optional.of(type.cast(entry.value)) : Optional.empty();
    }

    public void clear() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    // Concurrent writers may both sweep; removal is idempotent
    private void sweepIfDue(Instant now) {
        if (now.isBefore(nextSweep)) {
            return;
        }
        nextSweep = now.plus(sweepInterval);
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpiredAt(now));
        int removed = before - entries.size();
        if (removed > 0) {
            logger.debug("Swept {} expired responses, {} remain", removed, entries.size());
        }
    }

    private static final class Entry {
        private final Object value;
        private final Instant expiresAt;

        private Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
