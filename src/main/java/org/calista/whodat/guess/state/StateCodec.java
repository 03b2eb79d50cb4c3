package org.calista.whodat.guess.state;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.calista.whodat.guess.catalog.Catalog;
import org.calista.whodat.guess.catalog.Entity;

import java.io.IOException;
import java.util.*;

/**
 * {@link GameState} to/from a flat record and an opaque JSON blob.
 *
 * <p>
 * decode never defaults: a missing field, a wrong type, a non-finite score or an id the
 * catalog does not know is a {@link StateCorruptException}.
 * </p>
 */
public final class StateCodec {

    private static final Set<String> REQUIRED = Set.of("_schema", "turnCount", "phase", "guess", "asked", "excluded", "scores");

    private final ObjectMapper mapper;

    /** Duplicate keys are a parse error, not last-value-wins. */
    private final ObjectReader strictReader;

    public StateCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.strictReader = mapper.reader().with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    // ---------------------------------------------------------------------
    // Record level
    // ---------------------------------------------------------------------

    public StateRecord encode(GameState state) {
        Objects.requireNonNull(state, "state");
        if (state.phase() == Phase.RETRYING) {
            throw new IllegalStateException("RETRYING is transient and cannot be persisted");
        }
        StateRecord r = new StateRecord();
        r.turnCount = state.turnCount();
        r.phase = state.phase().name();
        r.guess = state.guess();
        r.asked = new ArrayList<>(state.asked());
        r.excluded = new ArrayList<>(state.excluded());
        r.scores = new TreeMap<>(state.scores());
        return r;
    }

    public GameState decode(StateRecord record, Catalog catalog) throws StateCorruptException {
        Objects.requireNonNull(catalog, "catalog");
        if (record == null) throw new StateCorruptException("State record is null");
        if (!StateRecord.SCHEMA.equals(record.schema)) {
            throw new StateCorruptException("Unsupported state schema: " + record.schema);
        }
        if (record.turnCount < 0) throw new StateCorruptException("Negative turnCount: " + record.turnCount);
        if (record.asked == null) throw new StateCorruptException("Missing field: asked");
        if (record.excluded == null) throw new StateCorruptException("Missing field: excluded");
        if (record.scores == null) throw new StateCorruptException("Missing field: scores");

        Phase phase = parsePhase(record.phase);

        for (String q : record.asked) {
            if (!catalog.hasQuestion(q)) throw new StateCorruptException("Unknown question id in asked: " + q);
        }
        for (String e : record.excluded) {
            if (!catalog.hasEntity(e)) throw new StateCorruptException("Unknown entity id in excluded: " + e);
        }
        for (Map.Entry<String, Double> s : record.scores.entrySet()) {
            if (!catalog.hasEntity(s.getKey())) throw new StateCorruptException("Unknown entity id in scores: " + s.getKey());
            Double v = s.getValue();
            if (v == null || !Double.isFinite(v)) {
                throw new StateCorruptException("Score for " + s.getKey() + " is not a finite number: " + v);
            }
        }
        for (Entity e : catalog.entities()) {
            if (!record.scores.containsKey(e.id)) throw new StateCorruptException("Score missing for entity: " + e.id);
        }

        boolean needsGuess = phase == Phase.GUESSING || phase == Phase.WON;
        if (needsGuess != (record.guess != null)) {
            throw new StateCorruptException("Guess " + record.guess + " inconsistent with phase " + phase);
        }
        if (record.guess != null) {
            if (!catalog.hasEntity(record.guess)) throw new StateCorruptException("Unknown guessed entity: " + record.guess);
            if (record.excluded.contains(record.guess)) {
                throw new StateCorruptException("Guessed entity is excluded: " + record.guess);
            }
        }

        return new GameState(record.scores, record.asked, record.excluded, record.turnCount, phase, record.guess);
    }

    // ---------------------------------------------------------------------
    // Blob level
    // ---------------------------------------------------------------------

    public byte[] serialize(GameState state) {
        try {
            return mapper.writeValueAsBytes(encode(state));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize game state", e);
        }
    }

    public GameState deserialize(byte[] blob, Catalog catalog) throws StateCorruptException {
        if (blob == null || blob.length == 0) throw new StateCorruptException("Empty state blob");

        JsonNode root;
        try {
            root = strictReader.readTree(blob);
        } catch (IOException e) {
            throw new StateCorruptException("State blob is not valid JSON: " + e.getMessage(), e);
        }
        return decode(toRecord(root), catalog);
    }

    /**
     * Tree-level checks, so a missing field never binds to a Java default.
     */
    private static StateRecord toRecord(JsonNode root) throws StateCorruptException {
        if (root == null || !root.isObject()) throw new StateCorruptException("State root must be a JSON object");
        for (String f : REQUIRED) {
            if (!root.has(f)) throw new StateCorruptException("Missing field: " + f);
        }

        StateRecord r = new StateRecord();
        r.schema = text(root.get("_schema"), "_schema", false);

        JsonNode turn = root.get("turnCount");
        if (!turn.isIntegralNumber() || !turn.canConvertToInt()) {
            throw new StateCorruptException("turnCount must be an integer: " + turn);
        }
        r.turnCount = turn.intValue();

        r.phase = text(root.get("phase"), "phase", false);
        r.guess = text(root.get("guess"), "guess", true);
        r.asked = ids(root.get("asked"), "asked");
        r.excluded = ids(root.get("excluded"), "excluded");

        JsonNode scores = root.get("scores");
        if (!scores.isObject()) throw new StateCorruptException("scores must be an object");
        TreeMap<String, Double> table = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = scores.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isNumber()) {
                throw new StateCorruptException("Score for " + e.getKey() + " must be a number: " + e.getValue());
            }
            table.put(e.getKey(), e.getValue().doubleValue());
        }
        r.scores = table;
        return r;
    }

    private static String text(JsonNode n, String field, boolean nullable) throws StateCorruptException {
        if (n.isNull()) {
            if (nullable) return null;
            throw new StateCorruptException(field + " must not be null");
        }
        if (!n.isTextual()) throw new StateCorruptException(field + " must be a string: " + n);
        return n.textValue();
    }

    private static List<String> ids(JsonNode n, String field) throws StateCorruptException {
        if (!n.isArray()) throw new StateCorruptException(field + " must be an array");
        ArrayList<String> out = new ArrayList<>(n.size());
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        for (JsonNode x : n) {
            if (!x.isTextual()) throw new StateCorruptException(field + " entries must be strings: " + x);
            if (!seen.add(x.textValue())) throw new StateCorruptException("Duplicate id in " + field + ": " + x.textValue());
            out.add(x.textValue());
        }
        return out;
    }

    private static Phase parsePhase(String raw) throws StateCorruptException {
        if (raw == null) throw new StateCorruptException("Missing field: phase");
        Phase p;
        try {
            p = Phase.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new StateCorruptException("Unknown phase: " + raw, e);
        }
        if (p == Phase.RETRYING) throw new StateCorruptException("Transient phase persisted: " + raw);
        return p;
    }
}
