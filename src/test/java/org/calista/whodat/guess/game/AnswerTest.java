package org.calista.whodat.guess.game;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnswerTest {

    @Test
    void parsesLabelsLoosely() {
        assertEquals(Answer.YES, Answer.parse("yes"));
        assertEquals(Answer.NO, Answer.parse("  NO "));
        assertEquals(Answer.PROBABLY_YES, Answer.parse("probably_yes"));
        assertEquals(Answer.PROBABLY_NO, Answer.parse("Probably  no"));
        assertEquals(Answer.PROBABLY_YES, Answer.parse("probably-yes"));
    }

    @Test
    void rejectsUnknownAnswer() {
        InvalidAnswerException e = assertThrows(InvalidAnswerException.class, () -> Answer.parse("maybe"));
        assertTrue(e.getMessage().contains("maybe"));
        assertThrows(InvalidAnswerException.class, () -> Answer.parse(null));
    }

    @Test
    void onlyGradedWeightsAreAccepted() {
        assertEquals(Answer.PROBABLY_NO, Answer.ofWeight(0.25));
        assertEquals(Answer.NO, Answer.ofWeight(-0.0));
        assertThrows(InvalidAnswerException.class, () -> Answer.ofWeight(0.5));
        assertThrows(InvalidAnswerException.class, () -> Answer.ofWeight(-0.25));
        assertThrows(InvalidAnswerException.class, () -> Answer.ofWeight(Double.NaN));
    }

    @Test
    void labelsInWeightOrder() {
        assertEquals(List.of("no", "probably no", "probably yes", "yes"), Answer.labels());
    }
}
