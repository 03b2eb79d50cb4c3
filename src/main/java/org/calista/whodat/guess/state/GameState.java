package org.calista.whodat.guess.state;

import java.util.*;

/**
 * The only mutable object of a game.
 *
 * <p>
 * No hidden fields: everything here round-trips through {@link StateCodec}.
 * Owned by exactly one session; not thread-safe.
 * </p>
 *
 * <p>
 * The write side is meant for {@code GameEngine} and {@code GuessController} only. Each mutator
 * enforces the invariants that need no catalog and throws {@link IllegalArgumentException}
 * before changing anything; catalog membership of question ids is checked by the engine.
 * </p>
 *
 * Invariants:
 * <ul>
 *   <li>{@code scores} holds every catalog entity (excluded ones stay for audit)</li>
 *   <li>{@code asked} and {@code excluded} only grow</li>
 *   <li>{@code guess} is non-null only in GUESSING or WON</li>
 * </ul>
 */
public final class GameState {

    private final TreeMap<String, Double> scores;
    private final TreeSet<String> asked;
    private final TreeSet<String> excluded;
    private int turnCount;
    private Phase phase;
    private String guess;

    public GameState(Map<String, Double> scores) {
        this(scores, Set.of(), Set.of(), 0, Phase.ASKING, null);
    }

    public GameState(Map<String, Double> scores,
                     Collection<String> asked,
                     Collection<String> excluded,
                     int turnCount,
                     Phase phase,
                     String guess) {
        this.scores = new TreeMap<>(Objects.requireNonNull(scores, "scores"));
        this.asked = new TreeSet<>(Objects.requireNonNull(asked, "asked"));
        this.excluded = new TreeSet<>(Objects.requireNonNull(excluded, "excluded"));
        if (turnCount < 0) throw new IllegalArgumentException("turnCount must be >= 0");
        if (!this.scores.keySet().containsAll(this.excluded)) {
            throw new IllegalArgumentException("Excluded ids must be scored entities: " + this.excluded);
        }
        Objects.requireNonNull(phase, "phase");
        checkGuess(phase, guess);
        this.turnCount = turnCount;
        this.phase = phase;
        this.guess = guess;
    }

    // -------------------- Read side --------------------

    /** Read-only view, sorted by entity id. */
    public SortedMap<String, Double> scores() {
        return Collections.unmodifiableSortedMap(scores);
    }

    public double score(String entityId) {
        Double s = scores.get(entityId);
        return s == null ? 0.0 : s;
    }

    public SortedSet<String> asked() {
        return Collections.unmodifiableSortedSet(asked);
    }

    public SortedSet<String> excluded() {
        return Collections.unmodifiableSortedSet(excluded);
    }

    public boolean isExcluded(String entityId) {
        return excluded.contains(entityId);
    }

    public int turnCount() {
        return turnCount;
    }

    public Phase phase() {
        return phase;
    }

    /** Entity id currently proposed, or null. */
    public String guess() {
        return guess;
    }

    // -------------------- Write side (engine only) --------------------

    /**
     * Replaces the score table. The new table must cover the same entity ids with finite scores.
     */
    public void commitScores(Map<String, Double> next) {
        Objects.requireNonNull(next, "next");
        if (!next.keySet().equals(scores.keySet())) {
            throw new IllegalArgumentException("Score table must keep the same entity ids");
        }
        for (Map.Entry<String, Double> e : next.entrySet()) {
            if (e.getValue() == null || !Double.isFinite(e.getValue())) {
                throw new IllegalArgumentException("Score for " + e.getKey() + " is not finite: " + e.getValue());
            }
        }
        scores.clear();
        scores.putAll(next);
    }

    public void markAsked(Collection<String> questionIds) {
        Objects.requireNonNull(questionIds, "questionIds");
        for (String id : questionIds) {
            if (id == null || id.isBlank()) throw new IllegalArgumentException("Blank question id");
        }
        asked.addAll(questionIds);
    }

    /** Only a scored entity can be excluded. */
    public void exclude(String entityId) {
        Objects.requireNonNull(entityId, "entityId");
        if (!scores.containsKey(entityId)) throw new IllegalArgumentException("Unknown entity: " + entityId);
        excluded.add(entityId);
    }

    public void incrementTurn() {
        turnCount++;
    }

    /**
     * A guess is required for GUESSING and WON, forbidden otherwise, and must be a scored,
     * non-excluded entity.
     */
    public void moveTo(Phase next, String guessedEntityId) {
        Objects.requireNonNull(next, "next");
        checkGuess(next, guessedEntityId);
        this.phase = next;
        this.guess = guessedEntityId;
    }

    private void checkGuess(Phase p, String g) {
        boolean needsGuess = p == Phase.GUESSING || p == Phase.WON;
        if (needsGuess != (g != null)) {
            throw new IllegalArgumentException("Guess " + g + " inconsistent with phase " + p);
        }
        if (g == null) return;
        if (!scores.containsKey(g)) throw new IllegalArgumentException("Unknown guessed entity: " + g);
        if (excluded.contains(g)) throw new IllegalArgumentException("Guessed entity is excluded: " + g);
    }

    // -------------------- Equality (round-trip checks) --------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameState s)) return false;
        return turnCount == s.turnCount
                && phase == s.phase
                && Objects.equals(guess, s.guess)
                && scores.equals(s.scores)
                && asked.equals(s.asked)
                && excluded.equals(s.excluded);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scores, asked, excluded, turnCount, phase, guess);
    }

    @Override
    public String toString() {
        return "GameState{phase=" + phase
                + ", turn=" + turnCount
                + ", guess=" + guess
                + ", asked=" + asked.size()
                + ", excluded=" + excluded
                + ", entities=" + scores.size()
                + '}';
    }
}
