package org.calista.whodat.guess.game;

/**
 * A move the current game cannot accept: unknown answer, weight outside the graded levels,
 * unknown or already answered attribute, unknown or already rejected entity, or a move on
 * a finished game. Always thrown before the state is touched.
 */
public final class InvalidAnswerException extends IllegalArgumentException {

    public InvalidAnswerException(String message) {
        super(message);
    }
}
