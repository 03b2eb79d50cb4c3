package org.calista.whodat.guess.game;

import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.Entity;
import org.calista.whodat.guess.catalog.Question;
import org.calista.whodat.guess.decide.Decision;
import org.calista.whodat.guess.decide.GuessController;
import org.calista.whodat.guess.score.ScoreModel;
import org.calista.whodat.guess.score.Scored;
import org.calista.whodat.guess.score.Softmax;
import org.calista.whodat.guess.state.GameState;
import org.calista.whodat.guess.state.Phase;
import org.calista.whodat.guess.state.StateCodec;
import org.calista.whodat.guess.state.StateCorruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * GameEngine — the operations a transport/session layer calls.
 *
 * <p>
 * Stateless apart from the immutable catalog and collaborators: every game lives in the
 * {@link GameState} passed in, so one engine serves any number of sessions. Each move
 * validates first and mutates second; a rejected move leaves the state untouched.
 * </p>
 */
public final class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final Catalog catalog;
    private final ScoreModel scoreModel;
    private final GuessController controller;
    private final StateCodec codec;

    public GameEngine(Catalog catalog, ScoreModel scoreModel, GuessController controller, StateCodec codec) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.scoreModel = Objects.requireNonNull(scoreModel, "scoreModel");
        this.controller = Objects.requireNonNull(controller, "controller");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Catalog catalog() {
        return catalog;
    }

    // ---------------------------------------------------------------------
    // Moves
    // ---------------------------------------------------------------------

    public GameStart newGame() {
        GameState state = new GameState(scoreModel.initialize(catalog));
        Decision d = controller.advance(catalog, state);
        return new GameStart(state, toTurn(state, d));
    }

    public Turn answer(GameState state, String attributeKey, Answer answer) {
        Objects.requireNonNull(answer, "answer");
        return answer(state, attributeKey, answer.weight);
    }

    /**
     * Folds one graded answer into the scores, then asks or guesses.
     *
     * @throws InvalidAnswerException weight not a graded level, attribute unknown or answered,
     *                                or the game is not waiting for an answer
     */
    public Turn answer(GameState state, String attributeKey, double answerWeight) {
        Objects.requireNonNull(state, "state");
        Answer.ofWeight(answerWeight);
        if (state.phase() != Phase.ASKING) {
            throw new InvalidAnswerException("Not waiting for an answer (phase=" + state.phase() + ")");
        }

        List<Question> probing = catalog.questionsFor(attributeKey);
        if (probing.isEmpty()) throw new InvalidAnswerException("Unknown attribute: " + attributeKey);

        ArrayList<String> newlyAsked = new ArrayList<>(probing.size());
        for (Question q : probing) {
            if (!state.asked().contains(q.id)) newlyAsked.add(q.id);
        }
        if (newlyAsked.isEmpty()) throw new InvalidAnswerException("Attribute already answered: " + attributeKey);

        SortedMap<String, Double> next = scoreModel.update(state.scores(), catalog, state.excluded(), attributeKey, answerWeight);

        state.commitScores(next);
        state.markAsked(newlyAsked);
        state.incrementTurn();

        Decision d = controller.advance(catalog, state);
        log.debug("answer attr={} w={} -> {}", attributeKey, answerWeight, d);
        return toTurn(state, d);
    }

    /**
     * The guess was wrong: exclude the entity and keep playing on what remains.
     */
    public Turn rejectGuess(GameState state, String entityId) {
        Objects.requireNonNull(state, "state");
        requireOpen(state);
        requirePlayable(state, entityId);

        Decision d = controller.reject(catalog, state, entityId);
        return toTurn(state, d);
    }

    /**
     * The guess was right: game over. Returns the final top candidates for display.
     */
    public List<Candidate> confirmGuess(GameState state, String entityId) {
        Objects.requireNonNull(state, "state");
        requireOpen(state);
        requirePlayable(state, entityId);

        controller.confirm(state, entityId);
        return topCandidates(ScoreModel.rank(state.scores(), state.excluded(), 0));
    }

    /**
     * Re-renders the current prompt of a state (e.g. right after {@link #deserialize}).
     * Pure: the state is not modified.
     */
    public Turn current(GameState state) {
        Objects.requireNonNull(state, "state");
        List<Scored<String>> ranking = ScoreModel.rank(state.scores(), state.excluded(), 0);

        switch (state.phase()) {
            case WON: {
                Candidate winner = candidate(state.guess(), state.score(state.guess()), 1.0);
                return new Turn(Phase.WON, null, winner, 1.0, topCandidates(ranking));
            }
            case GUESSING: {
                return guessTurn(state.guess(), ranking);
            }
            case NO_CANDIDATES: {
                return new Turn(Phase.NO_CANDIDATES, null, null, 0.0, List.of());
            }
            default: {
                return toTurn(state, controller.decide(catalog, state));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------

    public byte[] serialize(GameState state) {
        return codec.serialize(state);
    }

    public GameState deserialize(byte[] blob) throws StateCorruptException {
        return codec.deserialize(blob, catalog);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static void requireOpen(GameState state) {
        if (state.phase().isTerminal()) {
            throw new InvalidAnswerException("Game already finished (phase=" + state.phase() + ")");
        }
    }

    private void requirePlayable(GameState state, String entityId) {
        if (!catalog.hasEntity(entityId)) throw new InvalidAnswerException("Unknown entity: " + entityId);
        if (state.isExcluded(entityId)) throw new InvalidAnswerException("Entity already rejected: " + entityId);
    }

    private Turn toTurn(GameState state, Decision d) {
        switch (d.phase) {
            case ASKING:
                return new Turn(Phase.ASKING, d.question, null, certaintyOfTop(d.ranking), topCandidates(d.ranking));
            case GUESSING:
                return guessTurn(d.guess, d.ranking);
            case NO_CANDIDATES:
                log.debug("No candidates left after {} turns", state.turnCount());
                return new Turn(Phase.NO_CANDIDATES, null, null, 0.0, List.of());
            default:
                throw new IllegalStateException("Unexpected decision phase: " + d.phase);
        }
    }

    private Turn guessTurn(String guessId, List<Scored<String>> ranking) {
        double[] p = Softmax.probabilities(ranking, controller.policy().certaintyTemperature);
        double certainty = 0.0;
        double score = 0.0;
        for (int i = 0; i < ranking.size(); i++) {
            if (ranking.get(i).item.equals(guessId)) {
                certainty = p[i];
                score = ranking.get(i).score;
                break;
            }
        }
        return new Turn(Phase.GUESSING, null, candidate(guessId, score, certainty), certainty, topCandidates(ranking));
    }

    private double certaintyOfTop(List<Scored<String>> ranking) {
        double[] p = Softmax.probabilities(ranking, controller.policy().certaintyTemperature);
        return p.length == 0 ? 0.0 : p[0];
    }

    private List<Candidate> topCandidates(List<Scored<String>> ranking) {
        double[] p = Softmax.probabilities(ranking, controller.policy().certaintyTemperature);
        int n = Math.min(controller.policy().topN, ranking.size());
        ArrayList<Candidate> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Scored<String> s = ranking.get(i);
            out.add(candidate(s.item, s.score, p[i]));
        }
        return out;
    }

    private Candidate candidate(String id, double score, double probability) {
        String name = catalog.entity(id).map(e -> e.name).orElse(id);
        return new Candidate(id, name, score, probability);
    }

    /** Display name lookup for boundary messages. */
    public String displayName(String entityId) {
        return catalog.entity(entityId).map((Entity e) -> e.name).orElse(entityId);
    }
}
