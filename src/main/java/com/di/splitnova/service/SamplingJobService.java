package com.di.splitnova.service;

import com.di.splitnova.aspect.LogTransaction;
import com.di.splitnova.collection.InMemoryPartitionedCollection;
import com.di.splitnova.config.SamplingProperties;
import com.di.splitnova.controller.dto.PreviewRequest;
import com.di.splitnova.controller.dto.PreviewResponse;
import com.di.splitnova.controller.dto.SamplingJobRequest;
import com.di.splitnova.exception.RunNotFoundException;
import com.di.splitnova.pipeline.TextSamplingPipeline;
import com.di.splitnova.pipeline.TextSamplingSpec;
import com.di.splitnova.sampling.AdvisoryType;
import com.di.splitnova.sampling.InvalidConfigurationException;
import com.di.splitnova.sampling.SampledRecord;
import com.di.splitnova.sampling.SamplingAdvisory;
import com.di.splitnova.sampling.SamplingException;
import com.di.splitnova.sampling.SamplingRequest;
import com.di.splitnova.sampling.SamplingResult;
import com.di.splitnova.sampling.ScalableSrsSampler;
import com.di.splitnova.util.InputValidator;
import com.di.splitnova.util.SamplingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.runners.dataflow.DataflowPipelineJob;
import org.apache.beam.runners.dataflow.DataflowRunner;
import org.apache.beam.runners.dataflow.options.DataflowPipelineOptions;
import org.apache.beam.runners.direct.DirectRunner;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricQueryResults;
import org.apache.beam.sdk.metrics.MetricResult;
import org.apache.beam.sdk.metrics.MetricsFilter;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs sampling jobs over files with Beam and previews over inline records in memory, and keeps
 * the outcome of each in the {@link SamplingRunStore}.
 */
@Service
@Slf4j
public class SamplingJobService {

    static final String JOB_ID = "jobId";

    private final SamplingProperties properties;
    private final ScalableSrsSampler sampler;
    private final SamplingRunStore runStore;
    private final SamplingMetrics metrics;
    private final Clock clock;
    private final ApplicationContext applicationContext;

    @Value("${splitnova.dataflow.project:}")
    private String dataflowProject;
    @Value("${splitnova.dataflow.region:}")
    private String dataflowRegion;
    @Value("${splitnova.dataflow.temp-location:}")
    private String dataflowTempLocation;

    public SamplingJobService(SamplingProperties properties, ScalableSrsSampler sampler,
                              SamplingRunStore runStore, SamplingMetrics metrics, Clock clock,
                              ApplicationContext applicationContext) {
        this.properties = properties;
        this.sampler = sampler;
        this.runStore = runStore;
        this.metrics = metrics;
        this.clock = clock;
        this.applicationContext = applicationContext;
    }

    /** Call through proxy so @LogTransaction aspect runs (avoids self-invocation). */
    private SamplingJobService getSelf() {
        return applicationContext.getBean(SamplingJobService.class);
    }

    // ============================================================================
    // File jobs
    // ============================================================================

    /**
     * Samples the files matched by {@code request.input} into one output directory per set and
     * blocks until the pipeline finishes. Failed jobs are recorded in the run history before the
     * exception is re-thrown.
     */
    public SamplingRun runFileJob(SamplingJobRequest request) {
        String jobId = "sample-" + UUID.randomUUID();
        MDC.put(JOB_ID, jobId);
        Instant startedAt = clock.instant();
        SamplingRun.SamplingRunBuilder run = SamplingRun.builder()
                .runId(jobId)
                .kind(SamplingRun.Kind.FILE_JOB)
                .runner(properties.isDataflowRunner() ? "dataflow" : "direct")
                .input(request.getInput())
                .outputDir(request.getOutputDir())
                .requestedSizes(new LinkedHashMap<>(request.getSetSizes()))
                .startedAt(startedAt);
        try {
            SamplingRun finished = getSelf().executeFileJob(jobId, request, run);
            finished.setCompletedAt(clock.instant());
            finished.setDurationMs(Duration.between(startedAt, finished.getCompletedAt()).toMillis());
            metrics.recordJobSuccess(finished.getDurationMs(),
                    finished.getPopulation() != null ? finished.getPopulation() : 0,
                    finished.getSampledCounts().values().stream().mapToLong(Long::longValue).sum());
            runStore.save(finished);
            return finished;
        } catch (RuntimeException e) {
            Instant completedAt = clock.instant();
            long durationMs = Duration.between(startedAt, completedAt).toMillis();
            metrics.recordJobFailure(durationMs);
            runStore.save(run.status(SamplingRun.Status.FAILED)
                    .completedAt(completedAt)
                    .durationMs(durationMs)
                    .message(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build());
            throw e;
        } finally {
            MDC.remove(JOB_ID);
        }
    }

    /**
     * Builds and runs the pipeline for one file job. Public only so the transaction aspect can
     * intercept it; callers use {@link #runFileJob}.
     */
    @LogTransaction(
            eventType = "SAMPLING_JOB",
            transactionContext = "file_sampling",
            parameterNames = {"jobId", "request"}
    )
    public SamplingRun executeFileJob(String jobId, SamplingJobRequest request, SamplingRun.SamplingRunBuilder run) {
        String input = InputValidator.validateLocation(request.getInput(), "input");
        String outputDir = InputValidator.validateLocation(request.getOutputDir(), "output directory");
        InputValidator.validatePopulation(request.getCount());

        SamplingRequest samplingRequest = toSamplingRequest(request.getSetSizes(), request.getCount(),
                request.getDelta(), request.getSeed(), request.isReproportion());
        long seed = samplingRequest.getSeed();
        boolean cacheInput = request.getCacheInput() != null ? request.getCacheInput() : properties.isCacheInput();
        run.seed(seed).delta(samplingRequest.getDelta());

        Pipeline pipeline = Pipeline.create(buildOptions(jobId));
        TextSamplingPipeline.SamplingGraph graph = TextSamplingPipeline.expand(pipeline, TextSamplingSpec.builder()
                .inputPattern(input)
                .outputDir(outputDir)
                .request(samplingRequest)
                .cacheInput(cacheInput)
                .build());
        if (graph.partitionCount() == 0) {
            throw new InvalidConfigurationException("No input files match '" + input + "'");
        }
        log.info("[JOB] jobId={} runner={} partitions={} seed={} sets={}",
                jobId, properties.getRunner(), graph.partitionCount(), seed, graph.setNames());

        PipelineResult result = runAndWait(pipeline);
        if (result instanceof DataflowPipelineJob dataflowJob) {
            run.dataflowJobId(dataflowJob.getJobId());
        }

        Map<String, Long> counters = readCounters(result);
        Long population = graph.plan() != null
                ? Long.valueOf(graph.plan().population())
                : counters.get(TextSamplingPipeline.PLANNED_POPULATION);
        Map<String, Long> targets = plannedTargets(graph, counters);

        Map<String, Long> sampledCounts = new LinkedHashMap<>();
        for (String name : graph.setNames()) {
            sampledCounts.put(name, counters.getOrDefault(TextSamplingPipeline.SAMPLED_PREFIX + name, 0L));
        }
        List<String> advisories = new ArrayList<>();
        for (AdvisoryType type : AdvisoryType.values()) {
            long raised = counters.getOrDefault(TextSamplingPipeline.advisoryCounterName(type), 0L);
            metrics.recordAdvisory(type, raised);
            if (raised > 0) {
                advisories.add(String.format("%s raised for %d set(s)", type, raised));
            }
        }

        SamplingRun finished = run.status(SamplingRun.Status.SUCCEEDED)
                .population(population)
                .targetSizes(targets)
                .sampledCounts(sampledCounts)
                .advisories(advisories)
                .build();
        log.info("[JOB] jobId={} completed: population={} targets={} sampled={} advisories={}",
                jobId, population, targets, sampledCounts, advisories.size());
        return finished;
    }

    /**
     * Runs the pipeline to completion. Sampling errors raised inside a transform are unwrapped so
     * callers see the same exception as for an eagerly planned job.
     */
    private PipelineResult runAndWait(Pipeline pipeline) {
        try {
            PipelineResult result = pipeline.run();
            PipelineResult.State state = result.waitUntilFinish();
            if (state != null && state != PipelineResult.State.DONE) {
                throw new SamplingException("Sampling pipeline finished in state " + state);
            }
            return result;
        } catch (Pipeline.PipelineExecutionException e) {
            if (e.getCause() instanceof SamplingException samplingException) {
                throw samplingException;
            }
            throw e;
        }
    }

    PipelineOptions buildOptions(String jobId) {
        if (properties.isDataflowRunner()) {
            DataflowPipelineOptions options = PipelineOptionsFactory.as(DataflowPipelineOptions.class);
            options.setRunner(DataflowRunner.class);
            options.setJobName(jobId);
            if (dataflowProject != null && !dataflowProject.isBlank()) {
                options.setProject(dataflowProject.trim());
            }
            if (dataflowRegion != null && !dataflowRegion.isBlank()) {
                options.setRegion(dataflowRegion.trim());
            }
            if (dataflowTempLocation != null && !dataflowTempLocation.isBlank()) {
                options.setTempLocation(dataflowTempLocation.trim());
            }
            return options;
        }
        PipelineOptions options = PipelineOptionsFactory.create();
        options.setRunner(DirectRunner.class);
        options.setJobName(jobId);
        return options;
    }

    /**
     * Target sizes of the plan the pipeline ran with: the eager plan when the count was given,
     * otherwise the sizes reported by the planning step. Empty when the runner reported none.
     */
    static Map<String, Long> plannedTargets(TextSamplingPipeline.SamplingGraph graph, Map<String, Long> counters) {
        if (graph.plan() != null) {
            return new LinkedHashMap<>(graph.plan().targetSizes());
        }
        Map<String, Long> targets = new LinkedHashMap<>();
        for (String name : graph.setNames()) {
            Long target = counters.get(TextSamplingPipeline.TARGET_PREFIX + name);
            if (target == null) {
                log.warn("[JOB] Runner reported no planned target for set '{}'; target sizes left empty", name);
                return new LinkedHashMap<>();
            }
            targets.put(name, target);
        }
        return targets;
    }

    /** Sums each counter of the sampling namespace across steps; committed values when the runner has them. */
    static Map<String, Long> readCounters(PipelineResult result) {
        MetricQueryResults metricResults = result.metrics().queryMetrics(MetricsFilter.builder()
                .addNameFilter(MetricNameFilter.inNamespace(TextSamplingPipeline.METRICS_NAMESPACE))
                .build());
        Map<String, Long> counters = new LinkedHashMap<>();
        for (MetricResult<Long> counter : metricResults.getCounters()) {
            Long committed = counter.getCommittedOrNull();
            long value = committed != null ? committed : counter.getAttempted();
            counters.merge(counter.getName().getName(), value, Long::sum);
        }
        return counters;
    }

    // ============================================================================
    // Previews
    // ============================================================================

    /**
     * Samples inline records in memory with {@link ScalableSrsSampler}. The records are split into
     * {@code partitions} contiguous chunks; the population is the number of records. Rejected
     * previews are recorded as failed runs before the exception is re-thrown.
     */
    @LogTransaction(
            eventType = "SAMPLING_PREVIEW",
            transactionContext = "preview",
            parameterNames = {"request"}
    )
    public PreviewResponse preview(PreviewRequest request) {
        Instant startedAt = clock.instant();
        String runId = "preview-" + UUID.randomUUID().toString().substring(0, 8);
        SamplingRun.SamplingRunBuilder run = SamplingRun.builder()
                .runId(runId)
                .kind(SamplingRun.Kind.PREVIEW)
                .requestedSizes(request.getSetSizes() != null
                        ? new LinkedHashMap<>(request.getSetSizes()) : new LinkedHashMap<>())
                .startedAt(startedAt);
        try {
            List<String> records = request.getRecords();
            if (records.size() > properties.getMaxPreviewRecords()) {
                throw new IllegalArgumentException(String.format(
                        "Preview accepts at most %d records, got: %d", properties.getMaxPreviewRecords(), records.size()));
            }
            int partitions = InputValidator.validatePartitionCount(request.getPartitions());
            run.population((long) records.size());

            SamplingRequest samplingRequest = toSamplingRequest(request.getSetSizes(), (long) records.size(),
                    request.getDelta(), request.getSeed(), request.isReproportion());
            run.seed(samplingRequest.getSeed()).delta(samplingRequest.getDelta());
            SamplingResult<String> result = sampler.sample(
                    InMemoryPartitionedCollection.of(records, partitions), samplingRequest);

            Map<String, List<String>> sets = new LinkedHashMap<>();
            for (String name : result.plan().targetSizes().keySet()) {
                sets.put(name, new ArrayList<>());
            }
            for (SampledRecord<String> sampled : result.output().collect()) {
                sets.get(sampled.setName()).add(sampled.record());
            }
            Map<String, Long> sampledCounts = new LinkedHashMap<>();
            sets.forEach((name, members) -> sampledCounts.put(name, (long) members.size()));
            List<String> advisories = new ArrayList<>();
            for (SamplingAdvisory advisory : result.advisories()) {
                advisories.add(advisory.describe());
                metrics.recordAdvisory(advisory.type(), 1);
            }

            Instant completedAt = clock.instant();
            runStore.save(run.status(SamplingRun.Status.SUCCEEDED)
                    .targetSizes(new LinkedHashMap<>(result.plan().targetSizes()))
                    .sampledCounts(sampledCounts)
                    .advisories(advisories)
                    .completedAt(completedAt)
                    .durationMs(Duration.between(startedAt, completedAt).toMillis())
                    .build());

            return PreviewResponse.builder()
                    .runId(runId)
                    .seed(result.seed())
                    .population(records.size())
                    .targetSizes(result.plan().targetSizes())
                    .sets(sets)
                    .advisories(advisories)
                    .build();
        } catch (RuntimeException e) {
            Instant completedAt = clock.instant();
            runStore.save(run.status(SamplingRun.Status.FAILED)
                    .completedAt(completedAt)
                    .durationMs(Duration.between(startedAt, completedAt).toMillis())
                    .message(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build());
            throw e;
        }
    }

    // ============================================================================
    // Run history
    // ============================================================================

    public SamplingRun getRun(String runId) {
        return runStore.findByRunId(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public List<SamplingRun> recentRuns(int limit) {
        return runStore.findRecent(Math.max(1, Math.min(limit, properties.getRunHistorySize())));
    }

    /** Applies defaults and resolves the seed so every partition and both passes share one value. */
    private SamplingRequest toSamplingRequest(Map<String, Double> setSizes, Long count, Double delta,
                                              Long seed, boolean reproportion) {
        SamplingRequest.SamplingRequestBuilder builder = SamplingRequest.builder()
                .setSizes(setSizes)
                .count(count)
                .delta(delta != null ? delta : properties.getDefaultDelta())
                .reproportion(reproportion);
        SamplingRequest withoutSeed = builder.seed(seed).build();
        return withoutSeed.toBuilder().seed(withoutSeed.resolveSeed(clock)).build();
    }
}
