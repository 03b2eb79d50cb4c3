package org.calista.whodat.guess.session;

import org.calista.whodat.guess.events.EventStore;
import org.calista.whodat.guess.events.GameEvent;
import org.calista.whodat.guess.game.Answer;
import org.calista.whodat.guess.game.Candidate;
import org.calista.whodat.guess.game.GameEngine;
import org.calista.whodat.guess.game.GameStart;
import org.calista.whodat.guess.game.Turn;
import org.calista.whodat.guess.state.GameState;
import org.calista.whodat.guess.state.Phase;
import org.calista.whodat.guess.state.StateCorruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * GameSessions — start / answer / confirm keyed by session id.
 *
 * <p>
 * Each call rehydrates the game from the {@link SessionStore}, applies one move through the
 * {@link GameEngine} and stores the result. A won game is deleted from the store.
 * One in-flight call per session is assumed; the transport layer serializes per session.
 * </p>
 */
public final class GameSessions {
    private static final Logger log = LoggerFactory.getLogger(GameSessions.class);

    private final GameEngine engine;
    private final SessionStore store;
    private final EventStore events; // nullable: journal disabled
    private final Clock clock;

    public GameSessions(GameEngine engine, SessionStore store, EventStore events) {
        this(engine, store, events, Clock.systemUTC());
    }

    public GameSessions(GameEngine engine, SessionStore store, EventStore events, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
        this.events = events;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SessionTurn start() throws IOException {
        String sessionId = UUID.randomUUID().toString();
        GameStart g = engine.newGame();
        store.save(sessionId, engine.serialize(g.state));

        journal(GameEvent.Kind.START, sessionId, "entities=" + engine.catalog().entityCount());
        log.info("Session started: {}", sessionId);
        return reply(sessionId, g.turn);
    }

    /**
     * @param answerText one of {@link Answer#labels()}
     */
    public SessionTurn answer(String sessionId, String attributeKey, String answerText)
            throws IOException, StateCorruptException {
        Answer answer = Answer.parse(answerText);
        GameState state = load(sessionId);

        Turn t = engine.answer(state, attributeKey, answer);
        store.save(sessionId, engine.serialize(state));

        journal(GameEvent.Kind.ANSWER, sessionId, attributeKey + "=" + answer.label);
        return reply(sessionId, t);
    }

    /**
     * correct=true finishes the game and drops the session; false excludes the guess and plays on.
     */
    public SessionTurn confirm(String sessionId, String entityId, boolean correct)
            throws IOException, StateCorruptException {
        GameState state = load(sessionId);

        if (correct) {
            List<Candidate> top = engine.confirmGuess(state, entityId);
            store.delete(sessionId);

            journal(GameEvent.Kind.WON, sessionId, entityId);
            log.info("Session {} won with {} after {} turn(s)", sessionId, entityId, state.turnCount());
            Candidate winner = top.stream()
                    .filter(c -> c.id.equals(entityId))
                    .findFirst()
                    .orElseGet(() -> new Candidate(entityId, engine.displayName(entityId), state.score(entityId), 1.0));
            return reply(sessionId, new Turn(Phase.WON, null, winner, 1.0, top));
        }

        Turn t = engine.rejectGuess(state, entityId);
        journal(GameEvent.Kind.GUESS_REJECTED, sessionId, entityId);
        if (t.status == Phase.NO_CANDIDATES) {
            store.delete(sessionId);
            journal(GameEvent.Kind.GAVE_UP, sessionId, "turns=" + state.turnCount());
            log.info("Session {} exhausted all candidates", sessionId);
        } else {
            store.save(sessionId, engine.serialize(state));
        }
        return reply(sessionId, t);
    }

    /** Current prompt of a stored session, without changing it. */
    public SessionTurn resume(String sessionId) throws IOException, StateCorruptException {
        return reply(sessionId, engine.current(load(sessionId)));
    }

    public int evictIdle() throws IOException {
        return store.evictIdle(clock.instant());
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private GameState load(String sessionId) throws IOException, StateCorruptException {
        byte[] blob = store.load(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        try {
            return engine.deserialize(blob);
        } catch (StateCorruptException e) {
            log.warn("Failed to restore session {}: {}", sessionId, e.getMessage());
            throw e;
        }
    }

    private SessionTurn reply(String sessionId, Turn t) {
        return new SessionTurn(sessionId, t, messageFor(t));
    }

    static String messageFor(Turn t) {
        switch (t.status) {
            case ASKING:
                return t.question.text;
            case GUESSING:
                return "Is it " + t.guess.name + "?";
            case WON:
                return "Great! I knew it was " + t.guess.name + "!";
            case NO_CANDIDATES:
                return "I give up. I don't know this one.";
            default:
                return "";
        }
    }

    private void journal(GameEvent.Kind kind, String sessionId, String detail) throws IOException {
        if (events == null) return;
        events.append(GameEvent.of(kind, sessionId, detail, clock.millis()));
    }
}
