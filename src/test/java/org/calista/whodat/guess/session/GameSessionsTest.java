package org.calista.whodat.guess.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.whodat.guess.Fixtures;
import org.calista.whodat.guess.MutableClock;
import org.calista.whodat.guess.events.EventStore;
import org.calista.whodat.guess.events.GameEvent;
import org.calista.whodat.guess.game.InvalidAnswerException;
import org.calista.whodat.guess.state.Phase;
import org.calista.whodat.guess.state.StateCorruptException;
import org.calista.whodat.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameSessionsTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private InMemorySessionStore store;
    private EventStore events;
    private GameSessions sessions;

    @BeforeEach
    void setUp() {
        FileIO io = new FileIO(dir);
        store = new InMemorySessionStore(Duration.ofMinutes(30), clock);
        events = new EventStore(io, new ObjectMapper(), io.resolve("events.jsonl"));
        sessions = new GameSessions(Fixtures.engine(Fixtures.tall()), store, events, clock);
    }

    @Test
    void fullGameThroughSessions() throws Exception {
        SessionTurn t = sessions.start();
        assertEquals(Phase.ASKING, t.turn.status);
        assertEquals("Is your person tall?", t.message);
        assertEquals(1, store.size());

        t = sessions.answer(t.sessionId, "tall", "Yes");
        assertEquals(Phase.GUESSING, t.turn.status);
        assertEquals("Is it Alice?", t.message);

        t = sessions.confirm(t.sessionId, "A", false);
        assertEquals("Is it Bob?", t.message);
        assertEquals(1, store.size());

        t = sessions.confirm(t.sessionId, "B", true);
        assertEquals(Phase.WON, t.turn.status);
        assertEquals("Great! I knew it was Bob!", t.message);
        assertEquals(0, store.size());

        List<GameEvent.Kind> kinds = events.readAll().stream().map(e -> e.kind).toList();
        assertEquals(List.of(GameEvent.Kind.START, GameEvent.Kind.ANSWER, GameEvent.Kind.GUESS_REJECTED, GameEvent.Kind.WON), kinds);
        events.readAll().forEach((GameEvent e) -> assertEquals(clock.millis(), e.tsEpochMs));
    }

    @Test
    void givingUpDropsTheSession() throws Exception {
        SessionTurn t = sessions.start();
        String id = t.sessionId;
        sessions.answer(id, "tall", "no");
        sessions.confirm(id, "B", false);

        t = sessions.confirm(id, "A", false);

        assertEquals(Phase.NO_CANDIDATES, t.turn.status);
        assertEquals("I give up. I don't know this one.", t.message);
        assertThrows(SessionNotFoundException.class, () -> sessions.resume(id));
    }

    @Test
    void badAnswerTextKeepsSession() throws Exception {
        SessionTurn t = sessions.start();
        byte[] before = store.load(t.sessionId).orElseThrow();

        assertThrows(InvalidAnswerException.class, () -> sessions.answer(t.sessionId, "tall", "perhaps"));

        assertArrayEquals(before, store.load(t.sessionId).orElseThrow());
        assertEquals(Phase.ASKING, sessions.resume(t.sessionId).turn.status);
    }

    @Test
    void unknownSession() {
        SessionNotFoundException e = assertThrows(SessionNotFoundException.class,
                () -> sessions.answer("missing", "tall", "yes"));
        assertEquals("Session ID 'missing' not found.", e.getMessage());
    }

    @Test
    void corruptBlobSurfacesAsStateCorrupt() {
        store.save("broken", "{\"phase\":\"ASKING\"}".getBytes(StandardCharsets.UTF_8));
        assertThrows(StateCorruptException.class, () -> sessions.resume("broken"));
    }

    @Test
    void idleSessionsExpire() throws Exception {
        SessionTurn t = sessions.start();
        clock.advance(Duration.ofMinutes(31));

        assertEquals(1, sessions.evictIdle());
        assertThrows(SessionNotFoundException.class, () -> sessions.resume(t.sessionId));
    }
}
