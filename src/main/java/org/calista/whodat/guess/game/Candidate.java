package org.calista.whodat.guess.game;

import java.util.Locale;
import java.util.Objects;

/**
 * Display row for a ranked entity.
 */
public final class Candidate {
    public final String id;
    public final String name;
    public final double score;

    /** Softmax share among the remaining candidates. */
    public final double probability;

    public Candidate(String id, String name, double score, double probability) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.score = score;
        this.probability = probability;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (%s) score=%.3f p=%.3f", name, id, score, probability);
    }
}
