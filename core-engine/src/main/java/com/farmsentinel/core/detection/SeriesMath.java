package com.farmsentinel.core.detection;

import java.util.Arrays;

/**
 * Numeric helpers shared by the detectors.
 */
final class SeriesMath {

    /** Relative size below which a deviation counts as zero. */
    static final double RELATIVE_EPSILON = 1e-9;

    private static final double EULER_GAMMA = 0.5772156649;

    private SeriesMath() {
    }

    /**
     * Average path length of an unsuccessful binary search tree lookup over
     * {@code n} points, the isolation forest normalizing constant c(n).
     */
    static double expectedPathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population standard deviation. */
    static double std(double[] values, double mean) {
        if (values.length == 0) {
            return 0.0;
        }
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    static double std(double[] values) {
        return std(values, mean(values));
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param sorted ascending values, non-empty
     * @param p      percentile in [0, 100]
     */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    static double[] sortedCopy(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    static double clip01(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    /**
     * @return how far {@code z} exceeds {@code threshold}, as a fraction of it, clipped to [0, 1]
     */
    static double excess(double z, double threshold) {
        if (Double.isInfinite(z)) {
            return 1.0;
        }
        return clip01((z - threshold) / threshold);
    }

    /**
     * Ratio of a deviation to a spread, where both below {@code tolerance} count as zero.
     * A real deviation against zero spread is infinitely surprising.
     */
    static double ratio(double deviation, double spread, double tolerance) {
        double d = Math.abs(deviation);
        if (d <= tolerance) {
            return 0.0;
        }
        if (spread <= tolerance) {
            return Double.POSITIVE_INFINITY;
        }
        return d / spread;
    }

    /**
     * @return absolute tolerance scaled to the magnitude of the values
     */
    static double tolerance(double[] values) {
        double maxAbs = 1.0;
        for (double v : values) {
            maxAbs = Math.max(maxAbs, Math.abs(v));
        }
        return RELATIVE_EPSILON * maxAbs;
    }

    static double euclidean(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /** Raw scores are reported finitely; infinite ratios are capped. */
    static double finite(double v) {
        return Double.isInfinite(v) ? Double.MAX_VALUE : v;
    }
}
