package org.calista.whodat.guess.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.CatalogLoader;
import org.calista.whodat.guess.decide.GuessController;
import org.calista.whodat.guess.decide.GuessPolicy;
import org.calista.whodat.guess.events.EventStore;
import org.calista.whodat.guess.game.GameEngine;
import org.calista.whodat.guess.score.ScoreModel;
import org.calista.whodat.guess.score.impl.LinearAgreementScoreModel;
import org.calista.whodat.guess.score.impl.LogLikelihoodScoreModel;
import org.calista.whodat.guess.select.QuestionSelector;
import org.calista.whodat.guess.select.SelectionConfig;
import org.calista.whodat.guess.select.impl.VarianceQuestionSelector;
import org.calista.whodat.guess.session.FileSessionStore;
import org.calista.whodat.guess.session.GameSessions;
import org.calista.whodat.guess.session.InMemorySessionStore;
import org.calista.whodat.guess.session.SessionStore;
import org.calista.whodat.guess.state.StateCodec;
import org.calista.whodat.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * GameKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   build(config) -> loadOrCreate config, load + validate catalog, wire engine and sessions
 *   use           -> engine() / sessions()
 *
 * A broken catalog fails build(): the process must not start with it.
 * No static singletons: the catalog is shared only through this instance.
 */
public final class GameKernel {

    private static final Logger log = LoggerFactory.getLogger(GameKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final GameConfig cfg;
    private final Catalog catalog;
    private final GameEngine engine;
    private final SessionStore store;
    private final EventStore events;
    private final GameSessions sessions;

    private GameKernel(FileIO io,
                       ObjectMapper mapper,
                       GameConfig cfg,
                       Catalog catalog,
                       GameEngine engine,
                       SessionStore store,
                       EventStore events,
                       GameSessions sessions) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
        this.events = events; // nullable allowed
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory the config file and relative data dirs resolve against.
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private Catalog catalog;
        private Clock clock = Clock.systemUTC();

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Preloaded catalog; skips the dataset files. */
        public Builder catalog(Catalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * @throws org.calista.whodat.guess.catalog.DatasetException when the catalog is broken
         */
        public GameKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            FileIO external = new FileIO(configRoot, charset);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            GameConfig cfg = GameConfig.loadOrCreate(external, cfgPath, om);

            Path base = Path.of(cfg.baseDir);
            FileIO io = new FileIO(base.isAbsolute() ? base : configRoot.resolve(base), charset);

            Catalog cat = this.catalog;
            if (cat == null) {
                Path catalogDir = configRoot.resolve(cfg.catalog.dir);
                cat = new CatalogLoader(external, om).load(
                        catalogDir.resolve(cfg.catalog.entitiesFile),
                        catalogDir.resolve(cfg.catalog.questionsFile));
            }

            GameEngine engine = composeEngine(cfg, cat, om);

            Duration ttl = Duration.ofMinutes(cfg.sessions.ttlMinutes);
            SessionStore store = "memory".equals(cfg.sessions.store)
                    ? new InMemorySessionStore(ttl, clock)
                    : new FileSessionStore(io, io.resolve(cfg.sessions.dir), ttl, clock);

            EventStore events = cfg.events.enabled
                    ? new EventStore(io, om, io.resolve(cfg.events.logFile))
                    : null;

            GameSessions sessions = new GameSessions(engine, store, events, clock);

            GameKernel k = new GameKernel(io, om, cfg, cat, engine, store, events, sessions);
            k.logCreated(cfgPath);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    static GameEngine composeEngine(GameConfig cfg, Catalog catalog, ObjectMapper mapper) {
        ScoreModel model = scoreModelOf(cfg);

        QuestionSelector selector = new VarianceQuestionSelector(new SelectionConfig(
                cfg.selection.windowMin,
                cfg.selection.windowFraction,
                SelectionConfig.defaults().minVariance));

        GuessPolicy policy = new GuessPolicy(
                cfg.guessing.marginThreshold,
                cfg.guessing.maxTurns,
                cfg.guessing.topN,
                cfg.guessing.certaintyTemperature);

        log.debug("Engine composed: model={}, policy={}", model.name(), policy);
        return new GameEngine(catalog, model, new GuessController(selector, policy), new StateCodec(mapper));
    }

    static ScoreModel scoreModelOf(GameConfig cfg) {
        if (LogLikelihoodScoreModel.NAME.equals(cfg.scoring.model)) {
            return new LogLikelihoodScoreModel(cfg.scoring.likelihoodFloor);
        }
        return new LinearAgreementScoreModel();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public GameConfig config() { return cfg; }
    public Catalog catalog() { return catalog; }
    public GameEngine engine() { return engine; }
    public SessionStore sessionStore() { return store; }
    public GameSessions sessions() { return sessions; }

    /** Null when the journal is disabled. */
    public EventStore eventStore() { return events; }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("GameKernel created: config={}, baseDir={}, catalog={}, scoring={}, sessions={}",
                cfgPath, io.baseDir(), catalog, cfg.scoring.model, cfg.sessions.store);
    }
}
