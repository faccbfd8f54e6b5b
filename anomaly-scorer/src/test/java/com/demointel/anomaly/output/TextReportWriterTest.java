package com.demointel.anomaly.output;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.AnomalyReport;
import com.demointel.anomaly.model.DistrictRisk;
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

class TextReportWriterTest {

    @TempDir
    Path outputDir;

    @Test
    void reportCarriesTotalsAndRanking() throws IOException {
        ScoredRecord severe = scored().severity(Severity.SEVERE).build();
        ScoredRecord warned = scored().earlyWarning(true).build();
        AnomalyReport report = AnomalyReport.builder()
                .records(List.of(severe, warned, scored().build()))
                .districtRanking(List.of(DistrictRisk.builder()
                        .district("Kollam").severeCases(1).avgImpact(1.2).dominantReason("Ageing population").build()))
                .policyAlerts(List.of(severe))
                .earlyWarningZones(List.of(warned))
                .build();
        AnomalyScorerProperties properties = new AnomalyScorerProperties();
        properties.getOutput().setOutputDir(outputDir.toString());

        new TextReportWriter(properties).write(report);

        String text = Files.readString(outputDir.resolve(TextReportWriter.REPORT_FILE));
        assertThat(text)
                .startsWith("UIDAI DEMOGRAPHIC INTELLIGENCE REPORT")
                .contains("Total records analysed: 3")
                .contains("Severe anomalies detected: 1")
                .contains("Early-warning zones detected: 1")
                .contains("Kollam")
                .contains("1.200")
                .contains("Ageing population")
                .contains("Interpretation:")
                .doesNotContain("\r");
    }
}
