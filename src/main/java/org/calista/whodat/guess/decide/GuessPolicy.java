package org.calista.whodat.guess.decide;

/**
 * Stop-asking knobs. Each trigger is independent (logical OR):
 * <ul>
 *   <li>top score leads the runner-up by at least {@code marginThreshold}</li>
 *   <li>no question can still separate the remaining candidates</li>
 *   <li>{@code turnCount >= maxTurns}</li>
 * </ul>
 */
public final class GuessPolicy {

    public final double marginThreshold;
    public final int maxTurns;

    /** How many candidates a guess/finish shows. */
    public final int topN;

    /** Softmax temperature for the displayed certainty. */
    public final double certaintyTemperature;

    public GuessPolicy(double marginThreshold, int maxTurns, int topN, double certaintyTemperature) {
        if (!Double.isFinite(marginThreshold) || marginThreshold < 0.0) {
            throw new IllegalArgumentException("marginThreshold must be finite and >= 0");
        }
        if (maxTurns < 1) throw new IllegalArgumentException("maxTurns must be >= 1");
        if (topN < 1) throw new IllegalArgumentException("topN must be >= 1");
        if (!Double.isFinite(certaintyTemperature) || certaintyTemperature <= 0.0) {
            throw new IllegalArgumentException("certaintyTemperature must be finite and > 0");
        }
        this.marginThreshold = marginThreshold;
        this.maxTurns = maxTurns;
        this.topN = topN;
        this.certaintyTemperature = certaintyTemperature;
    }

    public static GuessPolicy defaults() {
        return new GuessPolicy(3.0, 20, 5, 1.0);
    }

    @Override
    public String toString() {
        return "GuessPolicy{margin=" + marginThreshold + ", maxTurns=" + maxTurns + ", topN=" + topN
                + ", T=" + certaintyTemperature + '}';
    }
}
