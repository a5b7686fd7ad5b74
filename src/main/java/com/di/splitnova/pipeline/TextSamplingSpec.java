package com.di.splitnova.pipeline;

import com.di.splitnova.sampling.SamplingRequest;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs of a file-driven sampling job.
 */
@Value
@Builder
public class TextSamplingSpec {

    /** File pattern; every matched file is one partition (e.g. {@code /data/events/part-*}). */
    String inputPattern;

    /**
     * Root output directory; each set is written under {@code <outputDir>/<setName>/}.
     * When {@code null} the labelled records are returned but not written.
     */
    String outputDir;

    /** Sampling parameters. The seed must already be resolved. */
    SamplingRequest request;

    /** Read every partition once and reuse the lines in both passes. */
    boolean cacheInput;
}
