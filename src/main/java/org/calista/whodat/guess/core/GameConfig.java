package org.calista.whodat.guess.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.whodat.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * GameConfig — plain POJO config:
 * - defaults live in field initializers
 * - loadOrCreate() writes the defaults when the file is missing or blank
 * - validate() clamps out-of-range values back to defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GameConfig {

    private static final Logger log = LoggerFactory.getLogger(GameConfig.class);

    /** Runtime data dir (sessions, journal). */
    public String baseDir = "data";
    public CatalogFiles catalog = new CatalogFiles();
    public Scoring scoring = new Scoring();
    public Selection selection = new Selection();
    public Guessing guessing = new Guessing();
    public Sessions sessions = new Sessions();
    public Events events = new Events();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CatalogFiles {
        /** Resolved outside the baseDir sandbox. */
        public String dir = "catalog";
        public String entitiesFile = "characters_data.json";
        public String questionsFile = "questions.json";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Scoring {
        /** "linear" | "likelihood" */
        public String model = "linear";
        /** likelihood only: per-turn probability floor. */
        public double likelihoodFloor = 0.05;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Selection {
        public int windowMin = 10;
        public double windowFraction = 0.2;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Guessing {
        public double marginThreshold = 3.0;
        public int maxTurns = 20;
        public int topN = 5;
        public double certaintyTemperature = 1.0;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Sessions {
        /** "file" | "memory" */
        public String store = "file";
        /** Relative to baseDir. */
        public String dir = "sessions";
        public long ttlMinutes = 60;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public boolean enabled = true;
        public String logFile = "events.jsonl";
    }

    // -------------------- Load / Create --------------------

    public static GameConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            GameConfig created = new GameConfig();
            created.validate();
            save(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            GameConfig created = new GameConfig();
            created.validate();
            save(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        GameConfig cfg = mapper.readValue(json, GameConfig.class);
        if (cfg == null) cfg = new GameConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, GameConfig cfg) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (catalog == null) catalog = new CatalogFiles();
        if (catalog.dir == null || catalog.dir.isBlank()) catalog.dir = "catalog";
        if (catalog.entitiesFile == null || catalog.entitiesFile.isBlank()) catalog.entitiesFile = "characters_data.json";
        if (catalog.questionsFile == null || catalog.questionsFile.isBlank()) catalog.questionsFile = "questions.json";

        if (scoring == null) scoring = new Scoring();
        scoring.model = scoring.model == null ? "linear" : scoring.model.trim().toLowerCase(Locale.ROOT);
        if (!scoring.model.equals("linear") && !scoring.model.equals("likelihood")) {
            log.warn("Unknown scoring.model '{}' -> fallback to linear", scoring.model);
            scoring.model = "linear";
        }
        if (!(scoring.likelihoodFloor > 0.0 && scoring.likelihoodFloor < 1.0)) scoring.likelihoodFloor = 0.05;

        if (selection == null) selection = new Selection();
        if (selection.windowMin < 1) selection.windowMin = 1;
        if (!Double.isFinite(selection.windowFraction) || selection.windowFraction < 0.0 || selection.windowFraction > 1.0)
            selection.windowFraction = 0.2;

        if (guessing == null) guessing = new Guessing();
        if (!Double.isFinite(guessing.marginThreshold) || guessing.marginThreshold < 0.0) guessing.marginThreshold = 3.0;
        if (guessing.maxTurns < 1) guessing.maxTurns = 1;
        if (guessing.topN < 1) guessing.topN = 1;
        if (!(guessing.certaintyTemperature > 0.0) || !Double.isFinite(guessing.certaintyTemperature))
            guessing.certaintyTemperature = 1.0;

        if (sessions == null) sessions = new Sessions();
        sessions.store = sessions.store == null ? "file" : sessions.store.trim().toLowerCase(Locale.ROOT);
        if (!sessions.store.equals("file") && !sessions.store.equals("memory")) sessions.store = "file";
        if (sessions.dir == null || sessions.dir.isBlank()) sessions.dir = "sessions";
        if (sessions.ttlMinutes < 1) sessions.ttlMinutes = 1;

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";
    }
}
