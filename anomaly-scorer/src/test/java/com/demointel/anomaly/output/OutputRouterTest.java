package com.demointel.anomaly.output;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.config.AnomalyScorerProperties.Output.OutputMode;
import com.demointel.anomaly.model.AnalysisRun;
import com.demointel.anomaly.model.AnomalyReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OutputRouterTest {

    @Mock
    private CsvReportWriter csvReportWriter;
    @Mock
    private TextReportWriter textReportWriter;
    @Mock
    private RunManifestWriter runManifestWriter;

    private final AnomalyScorerProperties properties = new AnomalyScorerProperties();
    private final AnomalyReport report = AnomalyReport.empty();

    @Test
    void bothModeWritesTablesAndReport() {
        router().write(report);

        verify(csvReportWriter).write(report);
        verify(textReportWriter).write(report);
    }

    @Test
    void csvModeSkipsTheReport() {
        properties.getOutput().setMode(OutputMode.CSV);

        router().write(report);

        verify(csvReportWriter).write(report);
        verify(textReportWriter, never()).write(report);
    }

    @Test
    void manifestFailureDoesNotPropagate() {
        AnalysisRun run = AnalysisRun.builder().runId("r1").status("SUCCESS").build();
        doThrow(new UncheckedIOException("read-only", new IOException("read-only")))
                .when(runManifestWriter).write(run);

        router().writeRun(run);

        verify(runManifestWriter).write(run);
    }

    private OutputRouter router() {
        return new OutputRouter(csvReportWriter, textReportWriter, runManifestWriter, properties);
    }
}
