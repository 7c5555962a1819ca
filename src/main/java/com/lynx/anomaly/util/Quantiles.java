package com.lynx.anomaly.util;

import java.util.Arrays;

/**
 * Order statistics over double arrays. Percentiles use linear interpolation between
 * the two closest ranks, the same definition numeric libraries use by default.
 */
public final class Quantiles {

    private Quantiles() {}

    /**
     * @param values  input values, not modified
     * @param percent percentile in [0, 100]
     */
    public static double percentile(double[] values, double percent) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take a percentile of an empty array");
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return percentileOfSorted(sorted, percent);
    }

    public static double percentileOfSorted(double[] sorted, double percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("Percentile must be in [0, 100]: " + percent);
        }
        if (sorted.length == 1) return sorted[0];
        double rank = percent / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) return sorted[lower];
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /**
     * Median of the non-NaN entries, or NaN when there are none.
     */
    public static double nanMedian(double[] values) {
        double[] present = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        return present.length == 0 ? Double.NaN : median(present);
    }

    public static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Population standard deviation (divides by N). */
    public static double std(double[] values) {
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / values.length);
    }
}
