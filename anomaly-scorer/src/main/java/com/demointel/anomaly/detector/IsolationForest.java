package com.demointel.anomaly.detector;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ensemble of {@link IsolationTree}s.
 *
 * Anomalous points are isolated in fewer splits, so a shorter average path length
 * gives a score closer to -1; typical points sit near -0.5.
 *
 * Trees are grown in parallel. Every tree gets its own seed, drawn in order from the
 * master seed before any tree starts, so the forest does not depend on scheduling.
 */
@Slf4j
public final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data         rows to fit on, read only
     * @param ensembleSize number of trees
     * @param maxSamples   rows drawn per tree, capped at the number of rows
     * @param seed         master seed
     * @param parallelism  threads used to grow trees
     */
    public static IsolationForest fit(double[][] data, int ensembleSize, int maxSamples,
                                      long seed, int parallelism) {
        if (ensembleSize <= 0) {
            throw new IllegalArgumentException("ensembleSize must be positive: " + ensembleSize);
        }
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive: " + maxSamples);
        }
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on an empty matrix");
        }

        int sampleSize = Math.min(maxSamples, data.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));

        Random master = new Random(seed);
        List<Callable<IsolationTree>> tasks = new ArrayList<>(ensembleSize);
        for (int t = 0; t < ensembleSize; t++) {
            long treeSeed = master.nextLong();
            tasks.add(() -> {
                Random random = new Random(treeSeed);
                int[] rows = sampleWithoutReplacement(data.length, sampleSize, random);
                return IsolationTree.grow(data, rows, heightLimit, random);
            });
        }

        List<IsolationTree> trees = growAll(tasks, Math.max(1, parallelism));
        log.debug("Grew {} isolation trees on {} rows (subsample {}, height limit {})",
                trees.size(), data.length, sampleSize, heightLimit);
        return new IsolationForest(trees, sampleSize);
    }

    /** Raw anomaly score in [-1, 0); lower is more anomalous. */
    public double scoreSample(double[] x) {
        double total = 0d;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(x);
        }
        double meanPath = total / trees.size();
        double normaliser = averagePathLength(sampleSize);
        double ratio = normaliser == 0d ? 1d : meanPath / normaliser;
        return -Math.pow(2, -ratio);
    }

    public double[] scoreSamples(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = scoreSample(data[i]);
        }
        return scores;
    }

    public int size() {
        return trees.size();
    }

    /**
     * Expected path length of an unsuccessful search in a binary search tree of n nodes,
     * used to normalise depths: c(n) = 2H(n-1) - 2(n-1)/n, with c(1) = 0 and c(2) = 1.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0d;
        }
        if (n == 2) {
            return 1d;
        }
        double harmonic = Math.log(n - 1d) + EULER_GAMMA;
        return 2d * harmonic - 2d * (n - 1d) / n;
    }

    private static int[] sampleWithoutReplacement(int population, int size, Random random) {
        int[] pool = new int[population];
        for (int i = 0; i < population; i++) {
            pool[i] = i;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(population - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }

    private static List<IsolationTree> growAll(List<Callable<IsolationTree>> tasks, int parallelism) {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "isolation-tree-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<IsolationTree>> futures = executor.invokeAll(tasks);
            List<IsolationTree> trees = new ArrayList<>(futures.size());
            for (Future<IsolationTree> future : futures) {
                trees.add(future.get());
            }
            return trees;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while growing isolation trees", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to grow isolation tree: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
}
