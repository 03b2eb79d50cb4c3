package org.calista.whodat.guess;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.DatasetException;
import org.calista.whodat.guess.catalog.Entity;
import org.calista.whodat.guess.catalog.Question;
import org.calista.whodat.guess.decide.GuessController;
import org.calista.whodat.guess.decide.GuessPolicy;
import org.calista.whodat.guess.game.GameEngine;
import org.calista.whodat.guess.score.ScoreModel;
import org.calista.whodat.guess.score.impl.LinearAgreementScoreModel;
import org.calista.whodat.guess.select.impl.VarianceQuestionSelector;
import org.calista.whodat.guess.state.StateCodec;

import java.util.List;
import java.util.Map;

/**
 * Shared test catalogs and wiring.
 */
public final class Fixtures {

    private Fixtures() {}

    /** A{tall:1}, B{tall:0}, Q1 asks about tall. */
    public static Catalog tall() {
        return catalog(
                List.of(
                        new Entity("A", "Alice", Map.of("tall", 1.0)),
                        new Entity("B", "Bob", Map.of("tall", 0.0))),
                List.of(new Question("Q1", "tall", "Is your person tall?")));
    }

    /**
     * Six distinguishable developers over six attributes.
     * grace differs from ada only in wrote_language.
     */
    public static Catalog devs() {
        return catalog(
                List.of(
                        new Entity("ada", "Ada", attrs(1, 1, 0, 0, 0, 0)),
                        new Entity("grace", "Grace", attrs(1, 1, 1, 0, 0, 0)),
                        new Entity("linus", "Linus", attrs(0, 0, 0, 1, 1, 0)),
                        new Entity("guido", "Guido", attrs(0, 0, 1, 0, 1, 0)),
                        new Entity("tim", "Tim", attrs(0, 1, 0, 0, 1, 1)),
                        new Entity("brendan", "Brendan", attrs(0, 0, 1, 0, 1, 1))),
                List.of(
                        new Question("q01", "female", "Is it a woman?"),
                        new Question("q02", "pioneer", "Is it a pioneer?"),
                        new Question("q03", "wrote_language", "Did they write a language?"),
                        new Question("q04", "linux", "Linux?"),
                        new Question("q05", "alive", "Alive?"),
                        new Question("q06", "web", "Web?")));
    }

    public static Map<String, Double> attrs(double female, double pioneer, double lang, double linux, double alive, double web) {
        return Map.of(
                "female", female,
                "pioneer", pioneer,
                "wrote_language", lang,
                "linux", linux,
                "alive", alive,
                "web", web);
    }

    public static Catalog catalog(List<Entity> entities, List<Question> questions) {
        try {
            return Catalog.load(entities, questions);
        } catch (DatasetException e) {
            throw new IllegalStateException(e);
        }
    }

    public static GameEngine engine(Catalog catalog) {
        return engine(catalog, GuessPolicy.defaults());
    }

    public static GameEngine engine(Catalog catalog, GuessPolicy policy) {
        return engine(catalog, new LinearAgreementScoreModel(), policy);
    }

    public static GameEngine engine(Catalog catalog, ScoreModel model, GuessPolicy policy) {
        GuessController controller = new GuessController(new VarianceQuestionSelector(), policy);
        return new GameEngine(catalog, model, controller, new StateCodec(new ObjectMapper()));
    }
}
