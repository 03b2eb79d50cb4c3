package org.calista.whodat.guess.select;

/**
 * Candidate window for question selection.
 *
 * window = min(remaining, max(windowMin, ceil(windowFraction * remaining)))
 */
public final class SelectionConfig {

    public final int windowMin;
    public final double windowFraction;

    /** Attribute variance at or below this is treated as "resolved" (no split). */
    public final double minVariance;

    public SelectionConfig(int windowMin, double windowFraction, double minVariance) {
        if (windowMin < 1) throw new IllegalArgumentException("windowMin must be >= 1");
        if (!Double.isFinite(windowFraction) || windowFraction < 0.0 || windowFraction > 1.0) {
            throw new IllegalArgumentException("windowFraction must be in [0..1]");
        }
        if (!Double.isFinite(minVariance) || minVariance < 0.0) {
            throw new IllegalArgumentException("minVariance must be finite and >= 0");
        }
        this.windowMin = windowMin;
        this.windowFraction = windowFraction;
        this.minVariance = minVariance;
    }

    public static SelectionConfig defaults() {
        return new SelectionConfig(10, 0.2, 1e-12);
    }

    public int windowFor(int remaining) {
        if (remaining <= 0) return 0;
        int byFraction = (int) Math.ceil(windowFraction * remaining);
        return Math.min(remaining, Math.max(windowMin, byFraction));
    }

    @Override
    public String toString() {
        return "SelectionConfig{windowMin=" + windowMin + ", windowFraction=" + windowFraction
                + ", minVariance=" + minVariance + '}';
    }
}
