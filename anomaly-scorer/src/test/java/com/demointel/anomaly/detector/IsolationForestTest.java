package com.demointel.anomaly.detector;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    @Test
    void averagePathLengthMatchesClosedForm() {
        assertThat(IsolationForest.averagePathLength(0)).isZero();
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isEqualTo(1d);
        assertThat(IsolationForest.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }

    @Test
    void isolatedPointGetsTheLowestScore() {
        double[][] data = cluster(300, 11);
        data[17] = new double[]{12, -12, 12, -12};

        IsolationForest forest = IsolationForest.fit(data, 100, 256, 42L, 2);
        double[] scores = forest.scoreSamples(data);

        int lowest = 0;
        for (int i = 1; i < scores.length; i++) {
            if (scores[i] < scores[lowest]) lowest = i;
        }
        assertThat(lowest).isEqualTo(17);
        for (double s : scores) {
            assertThat(s).isBetween(-1d, 0d);
        }
    }

    @Test
    void sameSeedGivesSameScoresWhateverTheParallelism() {
        double[][] data = cluster(120, 3);

        double[] serial = IsolationForest.fit(data, 50, 64, 42L, 1).scoreSamples(data);
        double[] parallel = IsolationForest.fit(data, 50, 64, 42L, 4).scoreSamples(data);

        assertThat(parallel).containsExactly(serial);
    }

    @Test
    void singleRowScoresAtMidpoint() {
        IsolationForest forest = IsolationForest.fit(new double[][]{{1, 2, 3, 4}}, 10, 256, 42L, 1);

        assertThat(forest.scoreSample(new double[]{1, 2, 3, 4})).isEqualTo(-0.5);
    }

    @Test
    void rejectsNonPositiveEnsembleSize() {
        assertThatThrownBy(() -> IsolationForest.fit(cluster(10, 1), 0, 256, 42L, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ensembleSize");
    }

    static double[][] cluster(int rows, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[rows][4];
        for (double[] row : data) {
            for (int c = 0; c < row.length; c++) {
                row[c] = random.nextGaussian();
            }
        }
        return data;
    }
}
