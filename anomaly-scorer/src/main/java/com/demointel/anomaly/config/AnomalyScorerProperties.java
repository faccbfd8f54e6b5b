package com.demointel.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * All tunable constants of the scoring pipeline.
 *
 * Defaults reproduce the production audit run; tests construct this directly
 * and override single values.
 */
@Component
@ConfigurationProperties(prefix = "anomaly-scorer")
@Data
public class AnomalyScorerProperties {

    private Input input = new Input();
    private Output output = new Output();
    private Model model = new Model();
    private Severity severity = new Severity();
    private Explain explain = new Explain();
    private Policy policy = new Policy();
    private EarlyWarning earlyWarning = new EarlyWarning();
    private Trust trust = new Trust();
    private Impact impact = new Impact();
    private Run run = new Run();

    @Data
    public static class Input {
        private String dataDir = "data";
        private String fileGlob = "api_data_aadhar_demographic_*.csv";
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.BOTH;
        private String outputDir = "outputs";
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            CSV, REPORT, BOTH
        }
    }

    @Data
    public static class Model {
        private int ensembleSize = 250;
        private double contamination = 0.01;
        private long randomSeed = 42L;
        private int maxSamples = 256;
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Severity {
        /** Quantile of ml_score below which a record is SEVERE. */
        private double percentile = 0.01;
    }

    @Data
    public static class Explain {
        private double youthHeavyRatio = 0.45;
        private double ageingRatio = 0.10;
        private double shockThreshold = 5.0;
        private double swingFraction = 0.20;
    }

    @Data
    public static class Policy {
        private double immediateAudit = 0.85;
        private double targetedInvestigation = 0.65;
        private double monitor = 0.45;
    }

    @Data
    public static class EarlyWarning {
        private int voteThreshold = 2;
        private double persistence = 0.10;
        private double shock = 2.0;
        private double peerDeviation = 0.10;
    }

    @Data
    public static class Trust {
        private double persistenceWeight = 0.5;
        private double severeWeight = 0.5;
    }

    @Data
    public static class Impact {
        private double confidenceWeight = 0.4;
        private double persistenceWeight = 0.4;
        private double populationWeight = 0.2;
    }

    @Data
    public static class Run {
        private boolean runOnStartup = true;
    }
}
