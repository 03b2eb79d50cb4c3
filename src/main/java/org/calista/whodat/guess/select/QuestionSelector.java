package org.calista.whodat.guess.select;

import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.Question;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the next question to ask.
 *
 * Implementations must be deterministic: same inputs, same question.
 */
public interface QuestionSelector {

    /**
     * @return the most discriminating unasked question, or empty when no question can
     * still separate the remaining candidates (caller falls back to guessing)
     */
    Optional<Question> next(Catalog catalog, Set<String> asked, Map<String, Double> scores, Set<String> excluded);
}
