package org.calista.whodat.guess.select.impl;

import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.Entity;
import org.calista.whodat.guess.catalog.Question;
import org.calista.whodat.guess.score.ScoreModel;
import org.calista.whodat.guess.score.Scored;
import org.calista.whodat.guess.select.QuestionSelector;
import org.calista.whodat.guess.select.SelectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * VarianceQuestionSelector:
 *  - ranks remaining candidates and takes the top window
 *  - scores every unanswered attribute by the variance of its weights inside the window
 *  - picks the highest variance, ties by lowest question id
 *
 * <p>If the window is already uniform on every open attribute, the search widens once
 * to all remaining candidates before giving up.</p>
 */
public final class VarianceQuestionSelector implements QuestionSelector {
    private static final Logger log = LoggerFactory.getLogger(VarianceQuestionSelector.class);

    private final SelectionConfig cfg;

    public VarianceQuestionSelector() {
        this(SelectionConfig.defaults());
    }

    public VarianceQuestionSelector(SelectionConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    @Override
    public Optional<Question> next(Catalog catalog, Set<String> asked, Map<String, Double> scores, Set<String> excluded) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(scores, "scores");
        Set<String> askedIds = asked == null ? Set.of() : asked;

        List<Scored<String>> ranked = ScoreModel.rank(scores, excluded, 0);
        if (ranked.size() < 2) return Optional.empty();

        Set<String> answeredAttributes = answeredAttributes(catalog, askedIds);

        int k = cfg.windowFor(ranked.size());
        Optional<Question> best = pick(catalog, askedIds, answeredAttributes, entitiesOf(catalog, ranked, k));

        if (best.isEmpty() && k < ranked.size()) {
            log.debug("Window of {} is uniform on all open attributes, widening to {}", k, ranked.size());
            best = pick(catalog, askedIds, answeredAttributes, entitiesOf(catalog, ranked, ranked.size()));
        }

        best.ifPresent(q -> log.debug("Selected question {} (attr={})", q.id, q.attributeKey));
        return best;
    }

    /** Attribute variance among the given entities; population variance. */
    static double variance(List<Entity> window, String attributeKey) {
        if (window.isEmpty()) return 0.0;
        double sum = 0.0;
        for (Entity e : window) sum += e.weight(attributeKey);
        double mean = sum / window.size();

        double acc = 0.0;
        for (Entity e : window) {
            double d = e.weight(attributeKey) - mean;
            acc += d * d;
        }
        return acc / window.size();
    }

    private Optional<Question> pick(Catalog catalog, Set<String> asked, Set<String> answeredAttributes, List<Entity> window) {
        HashMap<String, Double> varianceByAttr = new HashMap<>();
        Question best = null;
        double bestVar = cfg.minVariance;

        // questions are sorted by id, strict '>' keeps the lowest id on ties
        for (Question q : catalog.questions()) {
            if (asked.contains(q.id)) continue;
            if (answeredAttributes.contains(q.attributeKey)) continue;

            double v = varianceByAttr.computeIfAbsent(q.attributeKey, a -> variance(window, a));
            if (v > bestVar) {
                bestVar = v;
                best = q;
            }
        }
        return Optional.ofNullable(best);
    }

    private static Set<String> answeredAttributes(Catalog catalog, Set<String> asked) {
        HashSet<String> out = new HashSet<>();
        for (String id : asked) {
            catalog.question(id).ifPresent(q -> out.add(q.attributeKey));
        }
        return out;
    }

    private static List<Entity> entitiesOf(Catalog catalog, List<Scored<String>> ranked, int k) {
        ArrayList<Entity> out = new ArrayList<>(k);
        for (int i = 0; i < k && i < ranked.size(); i++) {
            catalog.entity(ranked.get(i).item).ifPresent(out::add);
        }
        return out;
    }
}
