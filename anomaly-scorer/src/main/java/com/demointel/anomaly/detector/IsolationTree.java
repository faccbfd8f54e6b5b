package com.demointel.anomaly.detector;

import java.util.Random;

/**
 * A single randomized partitioning tree grown on a row subsample.
 *
 * Each internal node splits on a random non-constant feature at a threshold drawn
 * uniformly inside that feature's range in the node, so both children are never empty.
 */
public final class IsolationTree {

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    /**
     * @param data        full matrix, read only
     * @param rows        indices of the rows this tree is grown on
     * @param heightLimit maximum depth of an internal node
     * @param random      source of randomness owned by this tree
     */
    public static IsolationTree grow(double[][] data, int[] rows, int heightLimit, Random random) {
        return new IsolationTree(build(data, rows, 0, heightLimit, random));
    }

    /** Depth at which {@code x} lands, corrected by the expected depth of the leaf's remaining rows. */
    public double pathLength(double[] x) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = x[node.feature] < node.threshold ? node.left : node.right;
            depth++;
        }
        return depth + IsolationForest.averagePathLength(node.size);
    }

    private static Node build(double[][] data, int[] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }

        int features = data[rows[0]].length;
        double[] min = new double[features];
        double[] max = new double[features];
        int[] candidates = new int[features];
        int candidateCount = 0;
        for (int f = 0; f < features; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
            for (int row : rows) {
                min[f] = Math.min(min[f], data[row][f]);
                max[f] = Math.max(max[f], data[row][f]);
            }
            if (max[f] > min[f]) {
                candidates[candidateCount++] = f;
            }
        }
        if (candidateCount == 0) {
            return Node.leaf(rows.length);
        }

        int feature = candidates[random.nextInt(candidateCount)];
        double u;
        do {
            u = random.nextDouble();
        } while (u == 0d);
        double threshold = min[feature] + u * (max[feature] - min[feature]);

        int leftCount = 0;
        for (int row : rows) {
            if (data[row][feature] < threshold) leftCount++;
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int l = 0;
        int r = 0;
        for (int row : rows) {
            if (data[row][feature] < threshold) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }

        return Node.split(feature, threshold,
                build(data, left, depth + 1, heightLimit, random),
                build(data, right, depth + 1, heightLimit, random));
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0d, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
