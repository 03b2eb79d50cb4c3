package org.calista.whodat.guess.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.whodat.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads the entity and question datasets (JSON arrays) and builds a {@link Catalog}.
 *
 * <p>Any problem (missing file, bad JSON, failed validation) is a {@link DatasetException}:
 * there is no partial catalog.</p>
 */
public final class CatalogLoader {
    private static final Logger log = LogManager.getLogger(CatalogLoader.class);

    private static final TypeReference<List<Entity>> ENTITIES = new TypeReference<>() {};
    private static final TypeReference<List<Question>> QUESTIONS = new TypeReference<>() {};

    private final FileIO io;
    private final ObjectMapper mapper;

    public CatalogLoader(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Catalog load(Path entitiesFile, Path questionsFile) throws DatasetException {
        Objects.requireNonNull(entitiesFile, "entitiesFile");
        Objects.requireNonNull(questionsFile, "questionsFile");

        List<Entity> entities = read(entitiesFile, ENTITIES);
        List<Question> questions = read(questionsFile, QUESTIONS);

        Catalog catalog = Catalog.load(entities, questions);
        log.info("Catalog loaded: entities={} ({}), questions={} ({})",
                catalog.entityCount(), entitiesFile, catalog.questionCount(), questionsFile);
        return catalog;
    }

    /** Same validation as {@link #load(Path, Path)}, from in-memory JSON text. */
    public Catalog parse(String entitiesJson, String questionsJson) throws DatasetException {
        List<Entity> entities = parse(entitiesJson, ENTITIES, "entities");
        List<Question> questions = parse(questionsJson, QUESTIONS, "questions");
        return Catalog.load(entities, questions);
    }

    private <T> List<T> read(Path file, TypeReference<List<T>> type) throws DatasetException {
        if (!io.exists(file)) throw new DatasetException("Dataset not found: " + file);

        String json;
        try {
            json = io.readString(file);
        } catch (IOException e) {
            throw new DatasetException("Failed to read dataset " + file + ": " + e.getMessage(), e);
        }
        return parse(json, type, file.toString());
    }

    private <T> List<T> parse(String json, TypeReference<List<T>> type, String source) throws DatasetException {
        if (json == null || json.isBlank()) throw new DatasetException("Dataset is empty: " + source);
        try {
            List<T> out = mapper.readValue(json, type);
            if (out == null) throw new DatasetException("Dataset is null: " + source);
            return out;
        } catch (JsonProcessingException e) {
            throw new DatasetException("Bad dataset JSON in " + source + ": " + e.getOriginalMessage(), e);
        }
    }
}
