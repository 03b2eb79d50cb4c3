package org.calista.whodat.guess.session;

import org.calista.whodat.guess.game.Turn;

import java.util.Objects;

/**
 * A {@link Turn} addressed to a session, with the line to show the player.
 */
public final class SessionTurn {
    public final String sessionId;
    public final Turn turn;
    public final String message;

    public SessionTurn(String sessionId, Turn turn, String message) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.turn = Objects.requireNonNull(turn, "turn");
        this.message = message;
    }

    @Override
    public String toString() {
        return "SessionTurn{sessionId=" + sessionId + ", turn=" + turn + '}';
    }
}
