package com.storefront.anomaly.engine.forecast;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Dense, strictly hourly series starting at {@code start}. Hours with no observation hold 0.
 */
public final class HourlySeries {

    private final Instant start;
    private final double[] values;
    private final double[] prefixSums;

    public HourlySeries(Instant start, double[] values) {
        this.start = start;
        this.values = Arrays.copyOf(values, values.length);
        this.prefixSums = new double[values.length + 1];
        for (int i = 0; i < values.length; i++) {
            prefixSums[i + 1] = prefixSums[i] + values[i];
        }
    }

    public Instant getStart() {
        return start;
    }

    public int size() {
        return values.length;
    }

    public double valueAt(int index) {
        return values[index];
    }

    public Instant hourAt(int index) {
        return start.plus(Duration.ofHours(index));
    }

    /**
     * Index of the given hour, which may lie outside the series (negative or >= size).
     */
    public int indexOf(Instant hour) {
        return (int) Duration.between(start, hour).toHours();
    }

    /**
     * Sum of values in [from, to).
     */
    public double sum(int from, int to) {
        int lo = Math.max(0, from);
        int hi = Math.min(values.length, to);
        if (hi <= lo) return 0.0;
        return prefixSums[hi] - prefixSums[lo];
    }

    /**
     * Copy of the values in [from, to).
     */
    public double[] window(int from, int to) {
        int lo = Math.max(0, from);
        int hi = Math.min(values.length, Math.max(lo, to));
        return Arrays.copyOfRange(values, lo, hi);
    }
}
