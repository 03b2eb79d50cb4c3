package org.calista.whodat.guess.score;

import java.util.List;

/**
 * Numerically stable softmax over ranked scores: exp((s - max) / T) / sum.
 */
public final class Softmax {

    private Softmax() {}

    /**
     * @param ranked      scores, any order
     * @param temperature > 0; lower sharpens the distribution
     * @return probabilities aligned with {@code ranked}; empty input gives an empty array
     */
    public static double[] probabilities(List<? extends Scored<?>> ranked, double temperature) {
        if (!(temperature > 0.0) || !Double.isFinite(temperature)) {
            throw new IllegalArgumentException("temperature must be finite and > 0: " + temperature);
        }
        if (ranked == null || ranked.isEmpty()) return new double[0];

        double max = Double.NEGATIVE_INFINITY;
        for (Scored<?> s : ranked) max = Math.max(max, s.score / temperature);
        if (!Double.isFinite(max)) max = 0.0;

        double[] out = new double[ranked.size()];
        double sum = 0.0;
        for (int i = 0; i < out.length; i++) {
            double lw = (ranked.get(i).score / temperature) - max;
            if (!Double.isFinite(lw)) lw = -50.0;
            out[i] = Math.exp(lw);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) out[i] /= sum;
        return out;
    }
}
