package org.calista.whodat.guess.decide;

import org.calista.whodat.guess.Fixtures;
import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.score.Scored;
import org.calista.whodat.guess.select.impl.VarianceQuestionSelector;
import org.calista.whodat.guess.state.GameState;
import org.calista.whodat.guess.state.Phase;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GuessControllerTest {

    private static GuessController controller(GuessPolicy policy) {
        return new GuessController(new VarianceQuestionSelector(), policy);
    }

    private static List<Scored<String>> ranking(double... scores) {
        ArrayList<Scored<String>> out = new ArrayList<>(scores.length);
        for (int i = 0; i < scores.length; i++) out.add(Scored.of("e" + i, scores[i]));
        return out;
    }

    @Test
    void emptyRankingNeverGuesses() {
        assertFalse(controller(GuessPolicy.defaults()).shouldGuess(List.of(), 100, false));
    }

    @Test
    void singleCandidateAlwaysGuesses() {
        assertTrue(controller(GuessPolicy.defaults()).shouldGuess(ranking(0.0), 0, true));
    }

    @Test
    void eachTriggerFiresIndependently() {
        GuessController c = controller(new GuessPolicy(3.0, 5, 5, 1.0));

        assertFalse(c.shouldGuess(ranking(2.0, 0.0), 1, true));
        assertTrue(c.shouldGuess(ranking(3.0, 0.0), 1, true), "margin");
        assertTrue(c.shouldGuess(ranking(2.0, 0.0), 1, false), "no questions left");
        assertTrue(c.shouldGuess(ranking(2.0, 0.0), 5, true), "max turns");
    }

    @Test
    void decideIsPure() {
        Catalog cat = Fixtures.devs();
        GuessController c = controller(GuessPolicy.defaults());
        GameState s = new GameState(Map.of(
                "ada", 0.0, "grace", 0.0, "linus", 0.0, "guido", 0.0, "tim", 0.0, "brendan", 0.0));
        GameState copy = new GameState(s.scores(), s.asked(), s.excluded(), s.turnCount(), s.phase(), s.guess());

        Decision d = c.decide(cat, s);

        assertEquals(Phase.ASKING, d.phase);
        assertEquals("q02", d.question.id);
        assertEquals(copy, s);
        assertFalse(c.shouldGuess(cat, s));
    }

    @Test
    void leaderPastMarginIsGuessed() {
        Catalog cat = Fixtures.tall();
        GuessController c = controller(GuessPolicy.defaults());
        GameState s = new GameState(Map.of("A", 1.0, "B", -1.0));

        Decision d = c.advance(cat, s);

        // gap of 2 is under the margin and Q1 is still open
        assertEquals(Phase.ASKING, d.phase);

        s.markAsked(List.of("Q1"));
        d = c.advance(cat, s);
        assertEquals(Phase.GUESSING, d.phase);
        assertEquals("A", d.guess);
        assertEquals("A", s.guess());
        assertEquals(Phase.GUESSING, s.phase());
    }

    @Test
    void rejectExcludesAndMovesOn() {
        Catalog cat = Fixtures.tall();
        GuessController c = controller(GuessPolicy.defaults());
        GameState s = new GameState(Map.of("A", 1.0, "B", -1.0), List.of("Q1"), List.of(), 1, Phase.GUESSING, "A");

        Decision d = c.reject(cat, s, "A");

        assertEquals(Phase.GUESSING, d.phase);
        assertEquals("B", d.guess);
        assertTrue(s.isExcluded("A"));
        assertTrue(d.ranking.stream().noneMatch(x -> x.item.equals("A")));

        d = c.reject(cat, s, "B");
        assertEquals(Phase.NO_CANDIDATES, d.phase);
        assertNull(s.guess());
        assertEquals(Phase.NO_CANDIDATES, s.phase());
    }

    @Test
    void confirmEndsTheGame() {
        GuessController c = controller(GuessPolicy.defaults());
        GameState s = new GameState(Map.of("A", 1.0, "B", -1.0), List.of("Q1"), List.of(), 1, Phase.GUESSING, "A");

        c.confirm(s, "A");

        assertEquals(Phase.WON, s.phase());
        assertThrows(IllegalStateException.class, () -> c.confirm(s, "A"));
        assertThrows(IllegalStateException.class, () -> c.reject(Fixtures.tall(), s, "B"));
    }

    @Test
    void policyRejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> new GuessPolicy(-1.0, 20, 5, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new GuessPolicy(3.0, 0, 5, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new GuessPolicy(3.0, 20, 5, 0.0));
    }
}
