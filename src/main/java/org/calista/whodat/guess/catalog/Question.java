package org.calista.whodat.guess.catalog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A yes/no prompt bound to exactly one attribute key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Question {

    public final String id;

    @JsonProperty("attribute_key")
    public final String attributeKey;

    public final String text;

    @JsonCreator
    public Question(@JsonProperty("id") String id,
                    @JsonProperty("attribute_key") @JsonAlias("attributeKey") String attributeKey,
                    @JsonProperty("text") String text) {
        this.id = id;
        this.attributeKey = attributeKey;
        this.text = text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Question q)) return false;
        return Objects.equals(id, q.id) && Objects.equals(attributeKey, q.attributeKey) && Objects.equals(text, q.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, attributeKey, text);
    }

    @Override
    public String toString() {
        return "Question{id='" + id + "', attr='" + attributeKey + "'}";
    }
}
