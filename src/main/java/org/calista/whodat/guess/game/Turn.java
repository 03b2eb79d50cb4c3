package org.calista.whodat.guess.game;

import org.calista.whodat.guess.catalog.Question;
import org.calista.whodat.guess.state.Phase;

import java.util.List;
import java.util.Objects;

/**
 * What the caller shows after a move: a question, a guess, a win, or a give-up.
 */
public final class Turn {
    public final Phase status;

    /** Non-null only when {@code status == ASKING}. */
    public final Question question;

    /** Non-null for GUESSING and WON. */
    public final Candidate guess;

    /** Probability of the guessed (or leading) candidate; 1.0 once won, 0.0 when exhausted. */
    public final double certainty;

    public final List<Candidate> topCandidates;

    public Turn(Phase status, Question question, Candidate guess, double certainty, List<Candidate> topCandidates) {
        this.status = Objects.requireNonNull(status, "status");
        this.question = question;
        this.guess = guess;
        this.certainty = certainty;
        this.topCandidates = topCandidates == null ? List.of() : List.copyOf(topCandidates);
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    @Override
    public String toString() {
        return "Turn{status=" + status
                + ", question=" + (question == null ? null : question.id)
                + ", guess=" + (guess == null ? null : guess.id)
                + ", certainty=" + certainty
                + ", top=" + topCandidates.size() + '}';
    }
}
