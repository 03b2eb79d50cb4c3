package org.calista.whodat.guess.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One journal line. Public fields for Jackson.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"tsEpochMs", "sessionId", "kind", "detail"})
public final class GameEvent {

    public enum Kind {
        START,
        ANSWER,
        GUESS_REJECTED,
        WON,
        GAVE_UP
    }

    public long tsEpochMs;
    public String sessionId;
    public Kind kind;

    /** attribute=answer, entity id, or a counter, depending on kind. */
    public String detail;

    public static GameEvent of(Kind kind, String sessionId, String detail, long tsEpochMs) {
        GameEvent e = new GameEvent();
        e.kind = kind;
        e.sessionId = sessionId;
        e.detail = detail;
        e.tsEpochMs = tsEpochMs;
        return e;
    }

    @Override
    public String toString() {
        return "GameEvent{" + kind + ", session=" + sessionId + ", detail=" + detail + '}';
    }
}
