package org.calista.whodat.guess.state;

/**
 * Game phase.
 *
 * <pre>
 * ASKING -> GUESSING -> WON
 *                    -> RETRYING -> ASKING | GUESSING | NO_CANDIDATES
 * </pre>
 *
 * RETRYING only exists while a rejected guess is being processed; it is never persisted.
 */
public enum Phase {
    ASKING,
    GUESSING,
    RETRYING,
    WON,
    NO_CANDIDATES;

    public boolean isTerminal() {
        return this == WON || this == NO_CANDIDATES;
    }
}
