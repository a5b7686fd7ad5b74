package com.di.splitnova.controller;

import com.di.splitnova.controller.dto.PreviewRequest;
import com.di.splitnova.controller.dto.PreviewResponse;
import com.di.splitnova.controller.dto.SamplingJobRequest;
import com.di.splitnova.service.SamplingJobService;
import com.di.splitnova.service.SamplingRun;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for sampling jobs.
 *
 * <p><strong>Base path:</strong> {@code /api/sampling}
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/sampling/jobs</td>
 *     <td>Sample files into one output directory per set (synchronous)</td></tr>
 * <tr><td>POST</td><td>/api/sampling/preview</td>
 *     <td>Sample inline records in memory and return the sets</td></tr>
 * <tr><td>GET</td><td>/api/sampling/runs/{runId}</td>
 *     <td>Fetch one run record</td></tr>
 * <tr><td>GET</td><td>/api/sampling/runs?limit=20</td>
 *     <td>List the most recent runs, newest first</td></tr>
 * </table>
 *
 * <p>{@code POST /api/sampling/jobs} blocks until the pipeline finishes. Invalid sizes and capacity
 * errors are returned as {@code 422} by the exception handler.
 */
@RestController
@RequestMapping("/api/sampling")
@Slf4j
@RequiredArgsConstructor
public class SamplingController {

    private final SamplingJobService samplingJobService;

    @PostMapping("/jobs")
    public ResponseEntity<SamplingRun> runJob(@Valid @RequestBody SamplingJobRequest request) {
        log.info("[CONTROLLER] POST /api/sampling/jobs input={} outputDir={} sets={}",
                request.getInput(), request.getOutputDir(), request.getSetSizes().keySet());
        SamplingRun run = samplingJobService.runFileJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(run);
    }

    @PostMapping("/preview")
    public ResponseEntity<PreviewResponse> preview(@Valid @RequestBody PreviewRequest request) {
        log.info("[CONTROLLER] POST /api/sampling/preview records={} partitions={} sets={}",
                request.getRecords().size(), request.getPartitions(), request.getSetSizes().keySet());
        return ResponseEntity.ok(samplingJobService.preview(request));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<SamplingRun> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(samplingJobService.getRun(runId));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<SamplingRun>> listRuns(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(samplingJobService.recentRuns(limit));
    }
}
