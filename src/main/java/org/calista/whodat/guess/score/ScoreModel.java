package org.calista.whodat.guess.score;

import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.Entity;

import java.util.*;

/**
 * A score model turns graded answers into per-entity running scores.
 *
 * Contract for implementations of {@link #contribution(double)}:
 *  - monotonic: a smaller distance never yields a smaller contribution
 *  - additive: the net effect of a turn does not depend on turn order
 *  - finite for every distance in [0..1], so hundreds of turns cannot overflow
 */
public interface ScoreModel {

    /** Config name ("linear", "likelihood"). */
    String name();

    /** Score delta for |attributeWeight - answerWeight| = distance, distance in [0..1]. */
    double contribution(double distance);

    /** Neutral starting score. */
    default double baseline() {
        return 0.0;
    }

    /**
     * Baseline score for every catalog entity.
     */
    default SortedMap<String, Double> initialize(Catalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        TreeMap<String, Double> out = new TreeMap<>();
        for (Entity e : catalog.entities()) out.put(e.id, baseline());
        return out;
    }

    /**
     * Returns a new score table; the input is not modified.
     * Excluded entities keep their previous score untouched.
     */
    default SortedMap<String, Double> update(Map<String, Double> scores,
                                             Catalog catalog,
                                             Set<String> excluded,
                                             String attributeKey,
                                             double answerWeight) {
        Objects.requireNonNull(scores, "scores");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(attributeKey, "attributeKey");
        if (!Double.isFinite(answerWeight) || answerWeight < 0.0 || answerWeight > 1.0) {
            throw new IllegalArgumentException("answerWeight must be in [0,1]: " + answerWeight);
        }

        TreeMap<String, Double> out = new TreeMap<>(scores);
        for (Entity e : catalog.entities()) {
            if (excluded != null && excluded.contains(e.id)) continue;
            double distance = Math.abs(e.weight(attributeKey) - answerWeight);
            double prev = out.getOrDefault(e.id, baseline());
            out.put(e.id, prev + contribution(distance));
        }
        return out;
    }

    /**
     * Descending by score, ties by entity id; excluded entities never appear.
     *
     * @param topN max entries, or <= 0 for all
     */
    static List<Scored<String>> rank(Map<String, Double> scores, Set<String> excluded, int topN) {
        Objects.requireNonNull(scores, "scores");
        ArrayList<Scored<String>> out = new ArrayList<>(scores.size());
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            if (excluded != null && excluded.contains(e.getKey())) continue;
            out.add(Scored.of(e.getKey(), e.getValue()));
        }
        Collections.sort(out);
        if (topN > 0 && out.size() > topN) return List.copyOf(out.subList(0, topN));
        return Collections.unmodifiableList(out);
    }
}
