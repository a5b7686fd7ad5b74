package com.di.splitnova.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response of the preview endpoint: the records of each set in input order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreviewResponse {
    private String runId;
    private long seed;
    private long population;
    private Map<String, Long> targetSizes;
    private Map<String, List<String>> sets;
    private List<String> advisories;
}
