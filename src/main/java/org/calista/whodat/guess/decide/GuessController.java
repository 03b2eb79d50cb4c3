package org.calista.whodat.guess.decide;

import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.Question;
import org.calista.whodat.guess.score.ScoreModel;
import org.calista.whodat.guess.score.Scored;
import org.calista.whodat.guess.select.QuestionSelector;
import org.calista.whodat.guess.state.GameState;
import org.calista.whodat.guess.state.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GuessController — ask-or-guess state machine.
 *
 * <pre>
 * ASKING -> GUESSING -> (WON | RETRYING)
 * RETRYING -> ASKING | GUESSING | NO_CANDIDATES
 * </pre>
 *
 * <p>Side effects are confined to {@link GameState}; no I/O. Callers validate ids first:
 * this class only guards its own preconditions.</p>
 */
public final class GuessController {
    private static final Logger log = LoggerFactory.getLogger(GuessController.class);

    private final QuestionSelector selector;
    private final GuessPolicy policy;

    public GuessController(QuestionSelector selector, GuessPolicy policy) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public GuessPolicy policy() {
        return policy;
    }

    // ---------------------------------------------------------------------
    // Stop condition
    // ---------------------------------------------------------------------

    /**
     * @param ranking        remaining candidates, best first
     * @param turnCount      answers processed so far
     * @param questionsLeft  whether a discriminating question still exists
     */
    public boolean shouldGuess(List<Scored<String>> ranking, int turnCount, boolean questionsLeft) {
        if (ranking == null || ranking.isEmpty()) return false;
        if (ranking.size() == 1) return true;

        double gap = ranking.get(0).score - ranking.get(1).score;
        if (gap >= policy.marginThreshold) return true;
        if (!questionsLeft) return true;
        return turnCount >= policy.maxTurns;
    }

    public boolean shouldGuess(Catalog catalog, GameState state) {
        return decide(catalog, state).phase == Phase.GUESSING;
    }

    /**
     * Pure evaluation of what the game should do next. Does not mutate {@code state}.
     */
    public Decision decide(Catalog catalog, GameState state) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(state, "state");

        List<Scored<String>> ranking = ScoreModel.rank(state.scores(), state.excluded(), 0);
        if (ranking.isEmpty()) {
            return new Decision(Phase.NO_CANDIDATES, null, null, ranking);
        }

        Optional<Question> next = selector.next(catalog, state.asked(), state.scores(), state.excluded());
        if (shouldGuess(ranking, state.turnCount(), next.isPresent())) {
            String top = ranking.get(0).item;
            log.debug("Guess {} at turn {} (remaining={}, questionsLeft={})",
                    top, state.turnCount(), ranking.size(), next.isPresent());
            return new Decision(Phase.GUESSING, null, top, ranking);
        }
        return new Decision(Phase.ASKING, next.get(), null, ranking);
    }

    /**
     * Evaluates and records the phase (and guess) on the state.
     */
    public Decision advance(Catalog catalog, GameState state) {
        Decision d = decide(catalog, state);
        state.moveTo(d.phase, d.guess);
        return d;
    }

    // ---------------------------------------------------------------------
    // Guess outcomes
    // ---------------------------------------------------------------------

    /** Caller asserts the guess was right. Terminal. */
    public void confirm(GameState state, String entityId) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(entityId, "entityId");
        if (state.phase().isTerminal()) throw new IllegalStateException("Game already finished: " + state.phase());
        if (state.isExcluded(entityId)) throw new IllegalArgumentException("Entity was already rejected: " + entityId);
        state.moveTo(Phase.WON, entityId);
    }

    /**
     * Excludes the entity and resumes on the remaining ranking.
     * Ends in NO_CANDIDATES when nothing is left.
     */
    public Decision reject(Catalog catalog, GameState state, String entityId) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(entityId, "entityId");
        if (state.phase().isTerminal()) throw new IllegalStateException("Game already finished: " + state.phase());
        if (!catalog.hasEntity(entityId)) throw new IllegalArgumentException("Unknown entity: " + entityId);

        state.exclude(entityId);
        state.moveTo(Phase.RETRYING, null);

        Decision d = advance(catalog, state);
        log.debug("Rejected {} -> {}", entityId, d);
        return d;
    }
}
