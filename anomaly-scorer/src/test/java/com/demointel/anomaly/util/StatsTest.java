package com.demointel.anomaly.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatsTest {

    @Test
    void quantileInterpolatesBetweenRanks() {
        double[] values = {4, 1, 3, 2};

        assertThat(Stats.quantile(values, 0.0)).isEqualTo(1);
        assertThat(Stats.quantile(values, 0.5)).isEqualTo(2.5);
        assertThat(Stats.quantile(values, 1.0)).isEqualTo(4);
        assertThat(Stats.quantile(values, 0.01)).isCloseTo(1.03, within(1e-12));
    }

    @Test
    void sampleStdDevUsesNMinusOne() {
        assertThat(Stats.sampleStdDev(new double[]{2, 4, 4, 4, 5, 5, 7, 9}))
                .isCloseTo(2.138089935, within(1e-9));
        assertThat(Stats.populationStdDev(new double[]{2, 4, 4, 4, 5, 5, 7, 9})).isEqualTo(2.0);
    }

    @Test
    void degenerateInputsYieldZero() {
        assertThat(Stats.sampleStdDev(new double[]{5})).isZero();
        assertThat(Stats.mean(new double[0])).isZero();
        assertThat(Stats.safeDivide(3, 0)).isZero();
        assertThat(Stats.safeDivide(Double.NaN, 2)).isZero();
    }

    @Test
    void roundsHalfToEven() {
        assertThat(Stats.round(0.125, 2)).isEqualTo(0.12);
        assertThat(Stats.round(0.135, 2)).isEqualTo(0.14);
        assertThat(Stats.round(-0.09999999999999998, 3)).isEqualTo(-0.1);
    }
}
