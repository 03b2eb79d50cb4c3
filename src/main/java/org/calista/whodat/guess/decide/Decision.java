package org.calista.whodat.guess.decide;

import org.calista.whodat.guess.catalog.Question;
import org.calista.whodat.guess.score.Scored;
import org.calista.whodat.guess.state.Phase;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one ask-or-guess evaluation.
 */
public final class Decision {
    public final Phase phase;

    /** Next question; non-null only for ASKING. */
    public final Question question;

    /** Proposed entity id; non-null only for GUESSING. */
    public final String guess;

    /** Remaining candidates, best first (excluded entities never appear). */
    public final List<Scored<String>> ranking;

    Decision(Phase phase, Question question, String guess, List<Scored<String>> ranking) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.question = question;
        this.guess = guess;
        this.ranking = ranking == null ? List.of() : List.copyOf(ranking);
    }

    @Override
    public String toString() {
        return "Decision{phase=" + phase
                + ", question=" + (question == null ? null : question.id)
                + ", guess=" + guess
                + ", remaining=" + ranking.size() + '}';
    }
}
