package com.example.highlight_planner.util;

import java.util.Arrays;
import java.util.Collection;

/**
 * Percentile with linear interpolation between the two closest ranks.
 */
public final class Percentiles {

    private Percentiles() {
    }

    public static double linear(Collection<Double> values, double percentile) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be in [0,100]");
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
