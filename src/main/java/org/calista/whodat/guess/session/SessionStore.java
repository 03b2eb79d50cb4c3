package org.calista.whodat.guess.session;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps one opaque state blob per session.
 *
 * <p>Byte-faithful: {@link #load} returns exactly what {@link #save} stored.
 * Every save refreshes the session's last-access time; sessions idle longer than the
 * store's TTL are invisible to {@link #load} and removed by {@link #evictIdle}.</p>
 */
public interface SessionStore {

    /** Insert or replace. */
    void save(String sessionId, byte[] blob) throws IOException;

    Optional<byte[]> load(String sessionId) throws IOException;

    /**
     * @return true if a session was removed
     */
    boolean delete(String sessionId) throws IOException;

    /**
     * Removes sessions whose last access is older than the TTL.
     *
     * @return how many sessions were removed
     */
    int evictIdle(Instant now) throws IOException;

    int size() throws IOException;
}
