package org.calista.whodat.guess.state;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GameStateTest {

    private static GameState fresh() {
        return new GameState(Map.of("A", 0.0, "B", 0.0));
    }

    @Test
    void excludeRejectsUnscoredEntity() {
        GameState s = fresh();
        assertThrows(IllegalArgumentException.class, () -> s.exclude("Z"));
        assertTrue(s.excluded().isEmpty());

        s.exclude("A");
        assertTrue(s.isExcluded("A"));
    }

    @Test
    void moveToChecksGuessAgainstPhase() {
        GameState s = fresh();
        assertThrows(IllegalArgumentException.class, () -> s.moveTo(Phase.GUESSING, null));
        assertThrows(IllegalArgumentException.class, () -> s.moveTo(Phase.ASKING, "A"));
        assertThrows(IllegalArgumentException.class, () -> s.moveTo(Phase.WON, "Z"));

        s.exclude("A");
        assertThrows(IllegalArgumentException.class, () -> s.moveTo(Phase.GUESSING, "A"));
        assertEquals(Phase.ASKING, s.phase());
        assertNull(s.guess());

        s.moveTo(Phase.GUESSING, "B");
        assertEquals("B", s.guess());
    }

    @Test
    void commitScoresKeepsEntitiesAndFiniteValues() {
        GameState s = fresh();
        assertThrows(IllegalArgumentException.class, () -> s.commitScores(Map.of("A", 1.0)));
        assertThrows(IllegalArgumentException.class, () -> s.commitScores(Map.of("A", 1.0, "B", Double.NaN)));
        assertEquals(0.0, s.score("A"));

        s.commitScores(Map.of("A", 1.0, "B", -1.0));
        assertEquals(1.0, s.score("A"));
    }

    @Test
    void markAskedRejectsBlankIds() {
        GameState s = fresh();
        assertThrows(IllegalArgumentException.class, () -> s.markAsked(List.of("q1", " ")));
        assertTrue(s.asked().isEmpty());
    }

    @Test
    void constructorRejectsInconsistentState() {
        Map<String, Double> scores = Map.of("A", 0.0, "B", 0.0);
        assertThrows(IllegalArgumentException.class,
                () -> new GameState(scores, List.of(), List.of("Z"), 0, Phase.ASKING, null));
        assertThrows(IllegalArgumentException.class,
                () -> new GameState(scores, List.of(), List.of("A"), 1, Phase.GUESSING, "A"));
        assertThrows(IllegalArgumentException.class,
                () -> new GameState(scores, List.of(), List.of(), -1, Phase.ASKING, null));
    }
}
