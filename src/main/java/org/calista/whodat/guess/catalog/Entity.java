package org.calista.whodat.guess.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One guessable candidate.
 *
 * <p>Attribute weights are in [0..1]: how strongly the trait holds for this entity.
 * Immutable once loaded; range checks happen in {@link Catalog#load}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Entity {

    /** Stable unique ID. */
    public final String id;

    /** Display name shown on a guess. */
    public final String name;

    /** attribute key -> weight, sorted by key. */
    public final Map<String, Double> attributes;

    @JsonCreator
    public Entity(@JsonProperty("id") String id,
                  @JsonProperty("name") String name,
                  @JsonProperty("attributes") Map<String, Double> attributes) {
        this.id = id;
        this.name = (name == null || name.isBlank()) ? id : name;
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(attributes));
    }

    /** Missing attribute reads as 0.0 (trait absent). */
    public double weight(String attributeKey) {
        Double w = attributes.get(attributeKey);
        return w == null ? 0.0 : w;
    }

    public boolean has(String attributeKey) {
        return attributes.containsKey(attributeKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity e)) return false;
        return Objects.equals(id, e.id) && Objects.equals(name, e.name) && Objects.equals(attributes, e.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, attributes);
    }

    @Override
    public String toString() {
        return "Entity{id='" + id + "', name='" + name + "', attrs=" + attributes.size() + '}';
    }
}
