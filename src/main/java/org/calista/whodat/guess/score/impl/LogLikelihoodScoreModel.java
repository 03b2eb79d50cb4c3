package org.calista.whodat.guess.score.impl;

import org.calista.whodat.guess.score.ScoreModel;

/**
 * score += ln(max(floor, 1 - distance)).
 *
 * <p>Accumulated log-likelihood: the product of per-turn agreement probabilities, kept in
 * log space so long games never underflow. The floor caps the penalty of one contradicting
 * answer at ln(floor), which keeps a single mistaken answer from eliminating the target.</p>
 */
public final class LogLikelihoodScoreModel implements ScoreModel {

    public static final String NAME = "likelihood";
    public static final double DEFAULT_FLOOR = 0.05;

    private final double floor;

    public LogLikelihoodScoreModel() {
        this(DEFAULT_FLOOR);
    }

    public LogLikelihoodScoreModel(double floor) {
        if (!(floor > 0.0 && floor < 1.0)) throw new IllegalArgumentException("floor must be in (0..1): " + floor);
        this.floor = floor;
    }

    public double floor() {
        return floor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double contribution(double distance) {
        return Math.log(Math.max(floor, 1.0 - distance));
    }
}
