package com.di.splitnova.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request body for {@code POST /api/sampling/jobs}: sample newline-delimited files into target sets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SamplingJobRequest {

    /** File pattern; each matched file is one partition. */
    @NotBlank(message = "input is required")
    private String input;

    /** Root directory under which each set is written to {@code <outputDir>/<set>/}. */
    @NotBlank(message = "outputDir is required")
    private String outputDir;

    /** Set name to size: {@code >= 1} is an absolute count, {@code < 1} a ratio of the population. */
    @NotEmpty(message = "setSizes must name at least one set")
    @Builder.Default
    private Map<String, @Positive(message = "set sizes must be positive") Double> setSizes = new LinkedHashMap<>();

    /** Population size when known; otherwise counted in an extra pass. */
    @Positive(message = "count must be positive")
    private Long count;

    /** Seed for the random keys; defaults to the current epoch second. */
    private Long seed;

    @Positive(message = "delta must be positive")
    @DecimalMax(value = "1.0", inclusive = false, message = "delta must be less than 1")
    private Double delta;

    /** Overrides {@code splitnova.sampling.cache-input} for this job. */
    private Boolean cacheInput;

    private boolean reproportion;
}
