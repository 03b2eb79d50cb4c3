package org.calista.whodat.guess.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.whodat.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One file per session: {@code <dir>/<sessionId>.json}.
 *
 * <p>
 * Writes go through {@link FileIO} atomic commit, so a crash never leaves half a blob.
 * The file's modification time is the session's last access.
 * </p>
 */
public final class FileSessionStore implements SessionStore {
    private static final Logger log = LogManager.getLogger(FileSessionStore.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,127}");
    private static final String SUFFIX = ".json";

    private final FileIO io;
    private final Path dir;
    private final Duration ttl;
    private final Clock clock;

    public FileSessionStore(FileIO io, Path dir, Duration ttl) {
        this(io, dir, ttl, Clock.systemUTC());
    }

    public FileSessionStore(FileIO io, Path dir, Duration ttl, Clock clock) {
        this.io = Objects.requireNonNull(io, "io");
        this.dir = Objects.requireNonNull(dir, "dir");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void save(String sessionId, byte[] blob) throws IOException {
        Objects.requireNonNull(blob, "blob");
        Path file = fileOf(sessionId);
        io.writeBytes(file, blob);
        io.setLastModified(file, clock.millis());
    }

    @Override
    public Optional<byte[]> load(String sessionId) throws IOException {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) return Optional.empty();
        Path file = fileOf(sessionId);
        if (!io.exists(file)) return Optional.empty();
        if (isIdle(file, clock.millis())) {
            io.deleteIfExists(file);
            log.debug("Session {} expired on load", sessionId);
            return Optional.empty();
        }
        return Optional.of(io.readBytes(file));
    }

    @Override
    public boolean delete(String sessionId) throws IOException {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) return false;
        return io.deleteIfExists(fileOf(sessionId));
    }

    @Override
    public int evictIdle(Instant now) throws IOException {
        long nowMs = now.toEpochMilli();
        int removed = 0;
        for (Path file : io.glob(dir, "*" + SUFFIX)) {
            if (isIdle(file, nowMs) && io.deleteIfExists(file)) removed++;
        }
        if (removed > 0) log.info("Evicted {} idle session(s) from {}", removed, dir);
        return removed;
    }

    @Override
    public int size() throws IOException {
        return io.glob(dir, "*" + SUFFIX).size();
    }

    private boolean isIdle(Path file, long nowMs) throws IOException {
        return nowMs - io.lastModified(file).toMillis() > ttl.toMillis();
    }

    private Path fileOf(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Unsafe session id: " + sessionId);
        }
        return dir.resolve(sessionId + SUFFIX);
    }
}
