package com.demointel.anomaly.detector;

/**
 * Per-row output of an {@link AnomalyDetector}, aligned with the input matrix rows.
 */
public record DetectionResult(double[] scores, boolean[] outliers) {

    public DetectionResult {
        if (scores.length != outliers.length) {
            throw new IllegalArgumentException(
                    "scores and outliers differ in length: " + scores.length + " vs " + outliers.length);
        }
    }

    public static DetectionResult empty() {
        return new DetectionResult(new double[0], new boolean[0]);
    }

    public int size() {
        return scores.length;
    }
}
