package org.calista.whodat.guess.game;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of graded answers. The engine only ever sees {@link #weight}.
 */
public enum Answer {
    NO("no", 0.0),
    PROBABLY_NO("probably no", 0.25),
    PROBABLY_YES("probably yes", 0.75),
    YES("yes", 1.0);

    public final String label;
    public final double weight;

    Answer(String label, double weight) {
        this.label = label;
        this.weight = weight;
    }

    /**
     * Case-insensitive; "probably_yes", "Probably  Yes" and "probably-yes" are all accepted.
     */
    public static Answer parse(String text) {
        if (text == null) throw new InvalidAnswerException("Answer is missing. Expected " + labels());
        String norm = text.trim()
                .toLowerCase(Locale.ROOT)
                .replace('_', ' ')
                .replace('-', ' ')
                .replaceAll("\\s+", " ");
        for (Answer a : values()) {
            if (a.label.equals(norm)) return a;
        }
        throw new InvalidAnswerException("Invalid answer '" + text + "'. Expected " + labels());
    }

    /** Only the four canonical weights are accepted. */
    public static Answer ofWeight(double weight) {
        for (Answer a : values()) {
            if (a.weight == weight) return a;
        }
        throw new InvalidAnswerException("Invalid answer weight " + weight + ". Expected one of "
                + Arrays.stream(values()).map(a -> String.valueOf(a.weight)).collect(Collectors.joining(", ")));
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(a -> a.label).collect(Collectors.toList());
    }
}
