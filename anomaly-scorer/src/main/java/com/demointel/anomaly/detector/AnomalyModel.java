package com.demointel.anomaly.detector;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.MlFlag;
import com.demointel.anomaly.model.ScoredRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends ml_flag and ml_score to every record.
 *
 * Builds the feature matrix {total_population, youth_ratio, pop_change, shock_score},
 * replaces non-finite values with 0, standardizes it and hands it to the configured
 * {@link AnomalyDetector}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnomalyModel {

    static final String[] FEATURE_NAMES = {
            "total_population", "youth_ratio", "pop_change", "shock_score"
    };

    private final AnomalyDetector detector;
    private final AnomalyScorerProperties properties;

    public List<ScoredRecord> score(List<ScoredRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }

        double[][] scaled = StandardScaler.fitTransform(featureMatrix(records));
        DetectionResult result = detector.detect(scaled, properties.getModel().getRandomSeed());
        if (result.size() != records.size()) {
            throw new IllegalStateException(
                    "Detector returned " + result.size() + " rows for " + records.size() + " records");
        }

        List<ScoredRecord> scored = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            scored.add(records.get(i).toBuilder()
                    .mlFlag(result.outliers()[i] ? MlFlag.OUTLIER : MlFlag.INLIER)
                    .mlScore(result.scores()[i])
                    .build());
        }
        return scored;
    }

    static double[][] featureMatrix(List<ScoredRecord> records) {
        double[][] matrix = new double[records.size()][];
        for (int i = 0; i < records.size(); i++) {
            ScoredRecord r = records.get(i);
            matrix[i] = new double[]{
                    finiteOrZero(r.getTotalPopulation()),
                    finiteOrZero(r.getYouthRatio()),
                    finiteOrZero(r.getPopChange()),
                    finiteOrZero(r.getShockScore())
            };
        }
        return matrix;
    }

    private static double finiteOrZero(Double value) {
        return value == null || !Double.isFinite(value) ? 0d : value;
    }
}
