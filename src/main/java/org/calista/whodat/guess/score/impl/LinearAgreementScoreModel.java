package org.calista.whodat.guess.score.impl;

import org.calista.whodat.guess.score.ScoreModel;

/**
 * score += 1 - 2 * distance.
 *
 * Exact agreement adds +1, full disagreement adds -1, "probably" answers land in between.
 * Bounded per turn, so the score after n turns stays within [-n, n].
 */
public final class LinearAgreementScoreModel implements ScoreModel {

    public static final String NAME = "linear";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double contribution(double distance) {
        return 1.0 - 2.0 * distance;
    }
}
