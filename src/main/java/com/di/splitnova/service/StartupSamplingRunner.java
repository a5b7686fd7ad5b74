package com.di.splitnova.service;

import com.di.splitnova.config.SamplingProperties;
import com.di.splitnova.controller.dto.SamplingJobRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * Runs the configured {@code splitnova.sampling.startup-job} once the context is ready, when
 * {@code splitnova.sampling.run-on-startup=true}. A failing job fails application startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "splitnova.sampling.run-on-startup", havingValue = "true")
public class StartupSamplingRunner implements ApplicationRunner {

    private final SamplingProperties properties;
    private final SamplingJobService samplingJobService;

    @Override
    public void run(ApplicationArguments args) {
        SamplingProperties.StartupJob job = properties.getStartupJob();
        if (job.getInput() == null || job.getSetSizes().isEmpty()) {
            throw new IllegalStateException(
                    "splitnova.sampling.run-on-startup is true but startup-job.input or startup-job.set-sizes is not set");
        }
        log.info("[JOB] Running startup sampling job: input={} outputDir={} sets={}",
                job.getInput(), job.getOutputDir(), job.getSetSizes());
        SamplingRun run = samplingJobService.runFileJob(SamplingJobRequest.builder()
                .input(job.getInput())
                .outputDir(job.getOutputDir())
                .setSizes(new LinkedHashMap<>(job.getSetSizes()))
                .count(job.getCount())
                .seed(job.getSeed())
                .reproportion(job.isReproportion())
                .build());
        log.info("[JOB] Startup sampling job {} finished: sampled={}", run.getRunId(), run.getSampledCounts());
    }
}
