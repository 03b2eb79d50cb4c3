package org.calista.whodat.guess.score;

import org.calista.whodat.guess.Fixtures;
import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.Entity;
import org.calista.whodat.guess.catalog.Question;
import org.calista.whodat.guess.score.impl.LinearAgreementScoreModel;
import org.calista.whodat.guess.score.impl.LogLikelihoodScoreModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class ScoreModelTest {

    private static final double[] LEVELS = {0.0, 0.25, 0.75, 1.0};

    /** Five entities spread over the graded levels of one attribute. */
    private static Catalog graded() {
        return Fixtures.catalog(
                List.of(
                        new Entity("e0", "E0", Map.of("x", 0.0)),
                        new Entity("e1", "E1", Map.of("x", 0.25)),
                        new Entity("e2", "E2", Map.of("x", 0.5)),
                        new Entity("e3", "E3", Map.of("x", 0.75)),
                        new Entity("e4", "E4", Map.of("x", 1.0))),
                List.of(new Question("q1", "x", "X?")));
    }

    @Test
    void initializeGivesEveryEntityTheBaseline() {
        ScoreModel m = new LinearAgreementScoreModel();
        SortedMap<String, Double> s = m.initialize(Fixtures.devs());
        assertEquals(6, s.size());
        s.values().forEach(v -> assertEquals(0.0, v));
    }

    @Test
    void closerWeightNeverScoresLower() {
        Catalog c = graded();
        for (ScoreModel m : List.of(new LinearAgreementScoreModel(), new LogLikelihoodScoreModel())) {
            for (double answer : LEVELS) {
                SortedMap<String, Double> s = m.update(m.initialize(c), c, Set.of(), "x", answer);
                for (Entity a : c.entities()) {
                    for (Entity b : c.entities()) {
                        double da = Math.abs(a.weight("x") - answer);
                        double db = Math.abs(b.weight("x") - answer);
                        if (da < db) {
                            assertTrue(s.get(a.id) >= s.get(b.id),
                                    m.name() + " answer=" + answer + ": " + a.id + " < " + b.id);
                        }
                    }
                }
            }
        }
    }

    @Test
    void linearContributionIsBoundedPerTurn() {
        ScoreModel m = new LinearAgreementScoreModel();
        assertEquals(1.0, m.contribution(0.0));
        assertEquals(-1.0, m.contribution(1.0));
        assertEquals(0.5, m.contribution(0.25));
    }

    @Test
    void likelihoodFloorCapsPenalty() {
        LogLikelihoodScoreModel m = new LogLikelihoodScoreModel(0.1);
        assertEquals(0.0, m.contribution(0.0));
        assertEquals(Math.log(0.1), m.contribution(1.0), 1e-12);
        assertTrue(Double.isFinite(m.contribution(1.0)));
        assertThrows(IllegalArgumentException.class, () -> new LogLikelihoodScoreModel(0.0));
    }

    @Test
    void updateDoesNotTouchInputOrExcluded() {
        Catalog c = Fixtures.tall();
        ScoreModel m = new LinearAgreementScoreModel();
        SortedMap<String, Double> before = m.initialize(c);

        SortedMap<String, Double> after = m.update(before, c, Set.of("B"), "tall", 1.0);

        assertEquals(0.0, before.get("A"));
        assertEquals(1.0, after.get("A"));
        assertEquals(0.0, after.get("B"));
    }

    @Test
    void updateRejectsWeightOutsideUnitInterval() {
        Catalog c = Fixtures.tall();
        ScoreModel m = new LinearAgreementScoreModel();
        assertThrows(IllegalArgumentException.class, () -> m.update(m.initialize(c), c, Set.of(), "tall", 1.5));
        assertThrows(IllegalArgumentException.class, () -> m.update(m.initialize(c), c, Set.of(), "tall", Double.NaN));
    }

    @Test
    void answerOrderDoesNotChangeFinalScores() {
        Catalog c = Fixtures.devs();
        ScoreModel m = new LinearAgreementScoreModel();

        SortedMap<String, Double> ab = m.update(m.update(m.initialize(c), c, Set.of(), "female", 0.75), c, Set.of(), "web", 0.25);
        SortedMap<String, Double> ba = m.update(m.update(m.initialize(c), c, Set.of(), "web", 0.25), c, Set.of(), "female", 0.75);

        for (String id : ab.keySet()) assertEquals(ab.get(id), ba.get(id), 1e-12, id);
    }

    @Test
    void scoresStayFiniteOverLongGames() {
        Catalog c = graded();
        for (ScoreModel m : List.of(new LinearAgreementScoreModel(), new LogLikelihoodScoreModel())) {
            SortedMap<String, Double> s = m.initialize(c);
            for (int i = 0; i < 500; i++) {
                s = m.update(s, c, Set.of(), "x", LEVELS[i % LEVELS.length]);
            }
            s.values().forEach(v -> assertTrue(Double.isFinite(v)));
            assertFalse(ScoreModel.rank(s, Set.of(), 0).isEmpty());
        }
    }

    @Test
    void rankOrdersDescendingWithIdTieBreak() {
        Map<String, Double> scores = Map.of("c", 1.0, "a", 2.0, "b", 1.0, "d", -3.0);

        List<Scored<String>> all = ScoreModel.rank(scores, Set.of(), 0);
        assertEquals(List.of("a", "b", "c", "d"), all.stream().map(s -> s.item).toList());

        List<Scored<String>> top2 = ScoreModel.rank(scores, Set.of("a"), 2);
        assertEquals(List.of("b", "c"), top2.stream().map(s -> s.item).toList());
    }

    @Test
    void softmaxSumsToOneAndFollowsRanking() {
        List<Scored<String>> ranked = ScoreModel.rank(Map.of("a", 3.0, "b", 1.0, "c", 1.0), Set.of(), 0);
        double[] p = Softmax.probabilities(ranked, 1.0);

        assertEquals(1.0, p[0] + p[1] + p[2], 1e-9);
        assertTrue(p[0] > p[1]);
        assertEquals(p[1], p[2], 1e-12);
        assertEquals(0, Softmax.probabilities(List.of(), 1.0).length);
        assertThrows(IllegalArgumentException.class, () -> Softmax.probabilities(ranked, 0.0));
    }
}
