package com.demointel.anomaly.detector;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.util.Stats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default {@link AnomalyDetector}: isolation forest with a contamination cutoff.
 *
 * The decision score is the raw forest score shifted so that the contamination
 * quantile sits at 0. Rows with a negative decision score are outliers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IsolationForestDetector implements AnomalyDetector {

    private final AnomalyScorerProperties properties;

    @Override
    public DetectionResult detect(double[][] matrix, long seed) {
        if (matrix.length == 0) {
            return DetectionResult.empty();
        }

        AnomalyScorerProperties.Model config = properties.getModel();
        double contamination = config.getContamination();
        if (!(contamination > 0d && contamination <= 0.5d)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5]: " + contamination);
        }

        IsolationForest forest = IsolationForest.fit(matrix, config.getEnsembleSize(),
                config.getMaxSamples(), seed, config.getParallelism());

        double[] raw = forest.scoreSamples(matrix);
        double offset = Stats.quantile(raw, contamination);

        double[] scores = new double[raw.length];
        boolean[] outliers = new boolean[raw.length];
        int outlierCount = 0;
        for (int i = 0; i < raw.length; i++) {
            scores[i] = raw[i] - offset;
            outliers[i] = scores[i] < 0d;
            if (outliers[i]) outlierCount++;
        }

        log.info("Isolation forest ({} trees, seed {}) flagged {} of {} rows as outliers",
                forest.size(), seed, outlierCount, raw.length);
        return new DetectionResult(scores, outliers);
    }
}
