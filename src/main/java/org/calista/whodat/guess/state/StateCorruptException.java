package org.calista.whodat.guess.state;

/**
 * A persisted game state could not be restored. Recover by starting a fresh game,
 * never by playing on with partial state.
 */
public final class StateCorruptException extends Exception {

    public StateCorruptException(String message) {
        super(message);
    }

    public StateCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
