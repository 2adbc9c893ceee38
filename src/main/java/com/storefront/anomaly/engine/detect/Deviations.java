package com.storefront.anomaly.engine.detect;

/**
 * Percent-difference arithmetic that never divides by zero or yields NaN.
 */
public final class Deviations {

    /**
     * Sentinel (and clamp) for percent diffs: reported when expected is 0 and actual is positive.
     */
    public static final double MAX_PERCENT_DIFF = 10_000.0;

    private Deviations() {}

    /**
     * (actual - expected) / expected * 100, with expected = 0 mapped to 0 (actual = 0)
     * or {@link #MAX_PERCENT_DIFF} (actual > 0). Clamped to +/- MAX_PERCENT_DIFF.
     */
    public static double percentDiff(double actual, double expected) {
        if (expected == 0.0) {
            if (actual == 0.0) return 0.0;
            return actual > 0 ? MAX_PERCENT_DIFF : -MAX_PERCENT_DIFF;
        }
        double pct = (actual - expected) / Math.abs(expected) * 100.0;
        return Math.max(-MAX_PERCENT_DIFF, Math.min(MAX_PERCENT_DIFF, pct));
    }

    /**
     * How far actual lies outside [lower, upper]; 0 inside.
     */
    public static double distanceOutside(double actual, double lower, double upper) {
        if (actual > upper) return actual - upper;
        if (actual < lower) return lower - actual;
        return 0.0;
    }
}
