package org.calista.whodat.guess.session;

import org.calista.whodat.guess.MutableClock;
import org.calista.whodat.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FileSessionStoreTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    private FileSessionStore store() {
        FileIO io = new FileIO(dir);
        return new FileSessionStore(io, io.resolve("sessions"), Duration.ofMinutes(10), clock);
    }

    @Test
    void savesOneFilePerSession() throws Exception {
        FileSessionStore store = store();
        byte[] blob = {0, 1, 2, (byte) 0xFF};

        store.save("abc-1", blob);

        assertTrue(Files.exists(dir.resolve("sessions").resolve("abc-1.json")));
        assertArrayEquals(blob, store.load("abc-1").orElseThrow());
        assertEquals(1, store.size());
    }

    @Test
    void unsafeIdsAreNeverResolved() throws Exception {
        FileSessionStore store = store();
        assertTrue(store.load("../etc/passwd").isEmpty());
        assertFalse(store.delete("../x"));
        assertThrows(IllegalArgumentException.class, () -> store.save("../x", new byte[]{1}));
    }

    @Test
    void idleSessionsAreEvicted() throws Exception {
        FileSessionStore store = store();
        store.save("old", new byte[]{1});
        clock.advance(Duration.ofMinutes(8));
        store.save("fresh", new byte[]{2});
        clock.advance(Duration.ofMinutes(5));

        assertEquals(1, store.evictIdle(clock.instant()));
        assertTrue(store.load("old").isEmpty());
        assertTrue(store.load("fresh").isPresent());
    }

    @Test
    void deleteRemovesFile() throws Exception {
        FileSessionStore store = store();
        store.save("s1", new byte[]{1});

        assertTrue(store.delete("s1"));
        assertFalse(store.delete("s1"));
        assertEquals(0, store.size());
    }
}
