package com.demointel.anomaly.service;

import com.demointel.anomaly.detector.AnomalyModel;
import com.demointel.anomaly.feature.FeatureBuilder;
import com.demointel.anomaly.model.AnomalyReport;
import com.demointel.anomaly.model.RawRecord;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.risk.PeerComparator;
import com.demointel.anomaly.risk.RiskComposer;
import com.demointel.anomaly.rules.EarlyWarningDetector;
import com.demointel.anomaly.rules.ExplainabilityEngine;
import com.demointel.anomaly.rules.PolicyEngine;
import com.demointel.anomaly.rules.SeverityClassifier;
import com.demointel.anomaly.rules.TrustScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the scoring stages in order over one table.
 *
 * Every stage returns a new list whose records carry the previous columns unchanged
 * plus the stage's own. Whole-table aggregates (persistence, state baseline) are
 * computed inside the stage that needs them, after all earlier stages have finished.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyPipeline {

    private final FeatureBuilder featureBuilder;
    private final AnomalyModel anomalyModel;
    private final SeverityClassifier severityClassifier;
    private final ExplainabilityEngine explainabilityEngine;
    private final RiskComposer riskComposer;
    private final PolicyEngine policyEngine;
    private final PeerComparator peerComparator;
    private final EarlyWarningDetector earlyWarningDetector;
    private final TrustScorer trustScorer;
    private final RiskAggregator riskAggregator;

    public AnomalyReport score(List<RawRecord> rawRecords) {
        List<ScoredRecord> records = featureBuilder.build(rawRecords);
        if (records.isEmpty()) {
            log.warn("No usable records among {} raw rows", rawRecords.size());
            return AnomalyReport.empty();
        }

        records = anomalyModel.score(records);
        records = severityClassifier.classify(records);
        records = explainabilityEngine.explain(records);
        records = riskComposer.compose(records);
        records = policyEngine.recommend(records);
        records = peerComparator.compare(records);
        records = earlyWarningDetector.detect(records);
        records = trustScorer.score(records);

        List<ScoredRecord> table = List.copyOf(records);
        AnomalyReport report = AnomalyReport.builder()
                .records(table)
                .districtRanking(riskAggregator.districtRanking(table))
                .policyAlerts(riskAggregator.policyAlerts(table))
                .earlyWarningZones(riskAggregator.earlyWarningZones(table))
                .build();

        log.info("Scored {} records: {} severe, {} early warnings, {} districts ranked",
                table.size(), report.severeCount(), report.earlyWarningCount(),
                report.getDistrictRanking().size());
        return report;
    }
}
