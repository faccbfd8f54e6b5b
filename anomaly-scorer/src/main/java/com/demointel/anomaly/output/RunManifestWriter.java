package com.demointel.anomaly.output;

import com.demointel.anomaly.config.AnomalyScorerProperties;
import com.demointel.anomaly.model.AnalysisRun;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes run metadata as analysis_run.json next to the output tables.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunManifestWriter {

    public static final String MANIFEST_FILE = "analysis_run.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final AnomalyScorerProperties properties;

    public void write(AnalysisRun run) {
        Path outputDir = Paths.get(properties.getOutput().getOutputDir());
        Path path = outputDir.resolve(MANIFEST_FILE);
        try {
            Files.createDirectories(outputDir);
            MAPPER.writeValue(path.toFile(), run);
            log.debug("Written run manifest: {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Run manifest write failed: " + path, e);
        }
    }
}
