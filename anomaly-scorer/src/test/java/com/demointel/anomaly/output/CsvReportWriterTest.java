package com.demointel.anomaly.output;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.AnomalyReport;
import com.demointel.anomaly.model.DistrictRisk;
import com.demointel.anomaly.model.MlFlag;
import com.demointel.anomaly.model.RecommendedAction;
import com.demointel.anomaly.model.ScoredRecord;
import com.demointel.anomaly.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.demointel.anomaly.TestRecords.scored;
import static org.assertj.core.api.Assertions.assertThat;

class CsvReportWriterTest {

    @TempDir
    Path outputDir;

    private final AnomalyScorerProperties properties = new AnomalyScorerProperties();

    @Test
    void writesAllFourTables() throws IOException {
        properties.getOutput().setOutputDir(outputDir.resolve("nested").toString());
        ScoredRecord severe = scored().severity(Severity.SEVERE).mlFlag(MlFlag.OUTLIER)
                .reason("Youth-heavy population; Large population swing")
                .recommendedAction(RecommendedAction.IMMEDIATE_AUDIT).build();
        AnomalyReport report = AnomalyReport.builder()
                .records(List.of(severe, scored().recommendedAction(RecommendedAction.NO_ACTION).build()))
                .districtRanking(List.of(DistrictRisk.builder()
                        .district("Bengaluru Urban").severeCases(1).avgImpact(1.3)
                        .dominantReason("Youth-heavy population; Large population swing").build()))
                .policyAlerts(List.of(severe))
                .earlyWarningZones(List.of())
                .build();

        new CsvReportWriter(properties).write(report);

        Path dir = outputDir.resolve("nested");
        List<String> scored = Files.readAllLines(dir.resolve(CsvReportWriter.SCORED_FILE));
        assertThat(scored).hasSize(3);
        assertThat(scored.get(0)).startsWith("\"date\",\"state\",\"district\",\"pincode\"");
        assertThat(scored.get(1))
                .contains("\"outlier\"", "\"SEVERE\"", "\"true\"", "\"Immediate audit & field verification\"");

        assertThat(Files.readAllLines(dir.resolve(CsvReportWriter.DISTRICT_FILE)))
                .containsExactly(
                        "\"district\",\"severe_cases\",\"avg_impact\",\"dominant_reason\"",
                        "\"Bengaluru Urban\",\"1\",\"1.3\",\"Youth-heavy population; Large population swing\"");
        assertThat(Files.readAllLines(dir.resolve(CsvReportWriter.ALERTS_FILE))).hasSize(2);
        assertThat(Files.readAllLines(dir.resolve(CsvReportWriter.EARLY_WARNING_FILE))).hasSize(1);
    }

    @Test
    void headerCanBeOmitted() throws IOException {
        properties.getOutput().setOutputDir(outputDir.toString());
        properties.getOutput().getCsv().setIncludeHeader(false);

        new CsvReportWriter(properties).write(AnomalyReport.empty());

        assertThat(Files.readAllLines(outputDir.resolve(CsvReportWriter.SCORED_FILE))).isEmpty();
    }

    @Test
    void rowHasOneValuePerHeader() {
        assertThat(CsvReportWriter.toRow(scored().build())).hasSameSizeAs(CsvReportWriter.RECORD_HEADERS);
    }
}
