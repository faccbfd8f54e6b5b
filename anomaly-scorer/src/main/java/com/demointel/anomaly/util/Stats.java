package com.demointel.anomaly.util;

import java.util.Arrays;

/**
 * Column statistics shared by the pipeline stages.
 * Degenerate inputs (empty, single value, zero spread) yield 0 rather than NaN.
 */
public final class Stats {

    private Stats() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double sum = 0d;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Standard deviation with n - 1 in the denominator; 0 when fewer than two values. */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return 0d;
        }
        return Math.sqrt(sumSquaredDeviations(values) / (values.length - 1));
    }

    /** Standard deviation with n in the denominator; 0 for an empty column. */
    public static double populationStdDev(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        return Math.sqrt(sumSquaredDeviations(values) / values.length);
    }

    /**
     * Quantile with linear interpolation between the closest ranks.
     *
     * @param q fraction in [0, 1]
     */
    public static double quantile(double[] values, double q) {
        if (values.length == 0) {
            return 0d;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double index = q * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    /** Half-to-even rounding of {@code value} to {@code places} decimals. */
    public static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.rint(value * scale) / scale;
    }

    public static double clip(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Divides, returning 0 when the denominator is 0 or either operand is not finite. */
    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0d || !Double.isFinite(denominator) || !Double.isFinite(numerator)) {
            return 0d;
        }
        return numerator / denominator;
    }

    private static double sumSquaredDeviations(double[] values) {
        double mean = mean(values);
        double sum = 0d;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum;
    }
}
