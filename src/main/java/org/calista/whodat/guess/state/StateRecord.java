package org.calista.whodat.guess.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * Flat, JSON-ready form of a {@link GameState}.
 * Public fields for Jackson; collections are sorted so equal states encode to equal bytes.
 */
@JsonPropertyOrder({"_schema", "turnCount", "phase", "guess", "asked", "excluded", "scores"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class StateRecord {

    public static final String SCHEMA = "whodat-state-v1";

    @JsonProperty("_schema")
    public String schema = SCHEMA;

    public int turnCount;
    public String phase;
    public String guess;
    public List<String> asked;
    public List<String> excluded;
    public Map<String, Double> scores;
}
