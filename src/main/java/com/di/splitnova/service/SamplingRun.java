package com.di.splitnova.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record of one finished file job or preview, kept in the run history and returned by the runs endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SamplingRun {

    public enum Kind { FILE_JOB, PREVIEW }

    public enum Status { SUCCEEDED, FAILED }

    private String runId;
    private Kind kind;
    private Status status;

    /** Beam runner name for file jobs ({@code direct} or {@code dataflow}). */
    private String runner;
    /** Dataflow job id when the job ran on Dataflow. */
    private String dataflowJobId;

    private String input;
    private String outputDir;

    private Long seed;
    private double delta;
    private Long population;

    @Builder.Default
    private Map<String, Double> requestedSizes = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Long> targetSizes = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Long> sampledCounts = new LinkedHashMap<>();
    @Builder.Default
    private List<String> advisories = new ArrayList<>();

    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;

    /** Failure message for {@link Status#FAILED} runs. */
    private String message;
}
