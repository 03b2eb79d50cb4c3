package org.calista.whodat.guess.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store. Blobs are copied in and out so callers cannot alias them.
 */
public final class InMemorySessionStore implements SessionStore {

    private static final class Entry {
        final byte[] blob;
        final long lastAccessMs;

        Entry(byte[] blob, long lastAccessMs) {
            this.blob = blob;
            this.lastAccessMs = lastAccessMs;
        }
    }

    private final Map<String, Entry> byId = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemorySessionStore(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public InMemorySessionStore(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void save(String sessionId, byte[] blob) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(blob, "blob");
        byId.put(sessionId, new Entry(Arrays.copyOf(blob, blob.length), clock.millis()));
    }

    @Override
    public Optional<byte[]> load(String sessionId) {
        if (sessionId == null) return Optional.empty();
        Entry e = byId.get(sessionId);
        if (e == null) return Optional.empty();
        if (isIdle(e, clock.millis())) {
            byId.remove(sessionId, e);
            return Optional.empty();
        }
        return Optional.of(Arrays.copyOf(e.blob, e.blob.length));
    }

    @Override
    public boolean delete(String sessionId) {
        if (sessionId == null) return false;
        return byId.remove(sessionId) != null;
    }

    @Override
    public int evictIdle(Instant now) {
        long nowMs = now.toEpochMilli();
        int removed = 0;
        for (Map.Entry<String, Entry> e : byId.entrySet()) {
            if (isIdle(e.getValue(), nowMs) && byId.remove(e.getKey(), e.getValue())) removed++;
        }
        return removed;
    }

    @Override
    public int size() {
        return byId.size();
    }

    private boolean isIdle(Entry e, long nowMs) {
        return nowMs - e.lastAccessMs > ttl.toMillis();
    }
}
