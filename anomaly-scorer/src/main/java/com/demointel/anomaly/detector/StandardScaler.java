package com.demointel.anomaly.detector;

import com.demointel.anomaly.util.Stats;

/**
 * Column-wise zero mean / unit variance scaling, fitted and applied on the same matrix.
 * A constant column scales to all zeros.
 */
public final class StandardScaler {

    private StandardScaler() {
    }

    public static double[][] fitTransform(double[][] matrix) {
        if (matrix.length == 0) {
            return new double[0][];
        }
        int rows = matrix.length;
        int cols = matrix[0].length;
        double[][] scaled = new double[rows][cols];

        for (int c = 0; c < cols; c++) {
            double[] column = new double[rows];
            for (int r = 0; r < rows; r++) {
                column[r] = matrix[r][c];
            }
            double mean = Stats.mean(column);
            double std = Stats.populationStdDev(column);
            for (int r = 0; r < rows; r++) {
                scaled[r][c] = std == 0d ? 0d : (column[r] - mean) / std;
            }
        }
        return scaled;
    }
}
