package com.demointel.anomaly.detector;

/**
 * Unsupervised outlier model over a standardized feature matrix.
 *
 * Implementations must be deterministic for a given matrix and seed.
 */
public interface AnomalyDetector {

    /**
     * @param matrix one row per record, already standardized
     * @param seed   random seed for any stochastic fitting
     * @return a decision score (lower = more anomalous) and an outlier flag per row
     */
    DetectionResult detect(double[][] matrix, long seed);
}
