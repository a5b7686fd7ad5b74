package com.di.splitnova.config;

import com.di.splitnova.sampling.ThresholdCalculator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sampling defaults and the optional startup job (from application.yml, prefix {@code splitnova.sampling}).
 */
@Data
@ConfigurationProperties(prefix = "splitnova.sampling")
public class SamplingProperties {

    /** Failure probability used when a request does not set one. */
    private double defaultDelta = ThresholdCalculator.DEFAULT_DELTA;

    /** Beam runner for file jobs: {@code direct} or {@code dataflow}. */
    private String runner = "direct";

    /** Whether file jobs cache each input file's lines between the two passes. */
    private boolean cacheInput = false;

    /** Upper bound on the number of inline records accepted by the preview endpoint. */
    private int maxPreviewRecords = 100_000;

    /** Number of finished runs kept in memory for the runs endpoints. */
    private int runHistorySize = 200;

    /** When true, {@link #startupJob} is executed once the application context is ready. */
    private boolean runOnStartup = false;

    private StartupJob startupJob = new StartupJob();

    /** Accepts {@code dataflow} or the runner class name {@code DataflowRunner}. */
    public boolean isDataflowRunner() {
        String value = runner != null ? runner.trim() : "";
        return "dataflow".equalsIgnoreCase(value) || "DataflowRunner".equalsIgnoreCase(value);
    }

    /**
     * File job executed at startup when {@code run-on-startup} is true.
     */
    @Data
    public static class StartupJob {
        /** Input file pattern, e.g. {@code /data/events-*.txt} or {@code gs://bucket/in/*.gz}. */
        private String input;
        /** Root directory; each set is written under {@code <output-dir>/<set>/}. */
        private String outputDir;
        /** Set name to absolute size (>= 1) or ratio (< 1). */
        private Map<String, Double> setSizes = new LinkedHashMap<>();
        /** Known population size; when absent it is counted in an extra pass. */
        private Long count;
        private Long seed;
        private boolean reproportion = false;
    }
}
