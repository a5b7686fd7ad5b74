package com.di.splitnova.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body for {@code POST /api/sampling/preview}: sample an inline list of records in memory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreviewRequest {

    @NotEmpty(message = "records must not be empty")
    @Builder.Default
    private List<String> records = new ArrayList<>();

    /** Number of in-memory partitions the records are split into. */
    @Min(value = 1, message = "partitions must be at least 1")
    @Max(value = 10_000, message = "partitions must be at most 10000")
    @Builder.Default
    private int partitions = 4;

    @NotEmpty(message = "setSizes must name at least one set")
    @Builder.Default
    private Map<String, @Positive(message = "set sizes must be positive") Double> setSizes = new LinkedHashMap<>();

    private Long seed;

    @Positive(message = "delta must be positive")
    @DecimalMax(value = "1.0", inclusive = false, message = "delta must be less than 1")
    private Double delta;

    private boolean reproportion;
}
