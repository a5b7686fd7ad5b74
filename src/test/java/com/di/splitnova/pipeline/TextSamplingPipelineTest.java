package com.di.splitnova.pipeline;

import com.di.splitnova.collection.InMemoryPartitionedCollection;
import com.di.splitnova.sampling.InvalidConfigurationException;
import com.di.splitnova.sampling.SampledRecord;
import com.di.splitnova.sampling.SamplingRequest;
import com.di.splitnova.sampling.ScalableSrsSampler;
import org.apache.beam.runners.direct.DirectRunner;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricResult;
import org.apache.beam.sdk.metrics.MetricsFilter;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.values.KV;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TextSamplingPipeline Tests")
class TextSamplingPipelineTest {

    private static final int FILES = 3;
    private static final int LINES_PER_FILE = 400;
    private static final long SEED = 2024L;

    @TempDir
    Path tempDir;

    private List<List<String>> partitions;
    private String inputPattern;

    @BeforeEach
    void writeInput() throws IOException {
        Path inputDir = Files.createDirectories(tempDir.resolve("in"));
        partitions = new ArrayList<>();
        for (int f = 0; f < FILES; f++) {
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < LINES_PER_FILE; i++) {
                lines.add("record-" + f + "-" + i);
            }
            Files.write(inputDir.resolve("part-" + f + ".txt"), lines, StandardCharsets.UTF_8);
            partitions.add(lines);
        }
        inputPattern = inputDir.resolve("part-*.txt").toString();
    }

    private static Pipeline newPipeline() {
        PipelineOptions options = PipelineOptionsFactory.create();
        options.setRunner(DirectRunner.class);
        return Pipeline.create(options);
    }

    private static SamplingRequest request(Long count) {
        return SamplingRequest.builder()
                .setSize("small", 100.0)
                .setSize("quarter", 0.25)
                .count(count)
                .seed(SEED)
                .build();
    }

    private static List<String> readSet(Path outputDir, String setName) throws IOException {
        List<String> lines = new ArrayList<>();
        try (Stream<Path> files = Files.list(outputDir.resolve(setName))) {
            for (Path file : files.filter(p -> p.getFileName().toString().startsWith("part")).collect(Collectors.toList())) {
                lines.addAll(Files.readAllLines(file, StandardCharsets.UTF_8));
            }
        }
        return lines;
    }

    private static Map<String, Long> counters(PipelineResult result) {
        Map<String, Long> counters = new HashMap<>();
        for (MetricResult<Long> counter : result.metrics().queryMetrics(MetricsFilter.builder()
                .addNameFilter(MetricNameFilter.inNamespace(TextSamplingPipeline.METRICS_NAMESPACE))
                .build()).getCounters()) {
            counters.merge(counter.getName().getName(), counter.getAttempted(), Long::sum);
        }
        return counters;
    }

    /** Same sample, computed in memory with the files as partitions. */
    private Map<String, Set<String>> expectedSample() {
        List<SampledRecord<String>> sampled = new ScalableSrsSampler()
                .sample(new InMemoryPartitionedCollection<>(partitions), request(null))
                .output().collect();
        return sampled.stream().collect(Collectors.groupingBy(SampledRecord::setName,
                Collectors.mapping(SampledRecord::record, Collectors.toSet())));
    }

    // ============================================================================
    // End to end
    // ============================================================================

    @Test
    @DisplayName("Should write exact-size disjoint sets, one directory per set")
    void testExpand_WritesSets() throws IOException {
        Path outputDir = tempDir.resolve("out");
        Pipeline pipeline = newPipeline();
        TextSamplingPipeline.SamplingGraph graph = TextSamplingPipeline.expand(pipeline, TextSamplingSpec.builder()
                .inputPattern(inputPattern)
                .outputDir(outputDir.toString())
                .request(request(null))
                .build());
        assertEquals(FILES, graph.partitionCount());
        assertEquals(List.of("small", "quarter"), graph.setNames());
        assertNull(graph.plan());

        PipelineResult result = pipeline.run();
        result.waitUntilFinish();

        List<String> small = readSet(outputDir, "small");
        List<String> quarter = readSet(outputDir, "quarter");
        assertEquals(100, small.size());
        assertEquals(300, quarter.size());

        Set<String> union = new HashSet<>(small);
        union.addAll(quarter);
        assertEquals(400, union.size());

        Map<String, Set<String>> expected = expectedSample();
        assertEquals(expected.get("small"), new HashSet<>(small));
        assertEquals(expected.get("quarter"), new HashSet<>(quarter));

        Map<String, Long> counters = counters(result);
        assertEquals(FILES * LINES_PER_FILE, counters.get(TextSamplingPipeline.RECORDS_CLASSIFIED));
        assertEquals(400L, counters.get(TextSamplingPipeline.RECORDS_SAMPLED));
        assertEquals(100L, counters.get(TextSamplingPipeline.SAMPLED_PREFIX + "small"));
        assertEquals(300L, counters.get(TextSamplingPipeline.SAMPLED_PREFIX + "quarter"));
        assertEquals(FILES * LINES_PER_FILE, counters.get(TextSamplingPipeline.PLANNED_POPULATION));
        assertEquals(100L, counters.get(TextSamplingPipeline.TARGET_PREFIX + "small"));
        assertEquals(300L, counters.get(TextSamplingPipeline.TARGET_PREFIX + "quarter"));
    }

    @Test
    @DisplayName("Should sample the same records with a known count, an unknown count or cached input")
    void testExpand_VariantsAgree() {
        Map<String, Set<String>> expected = expectedSample();
        for (Long count : new Long[]{null, (long) FILES * LINES_PER_FILE}) {
            for (boolean cache : new boolean[]{false, true}) {
                Pipeline pipeline = newPipeline();
                TextSamplingPipeline.SamplingGraph graph = TextSamplingPipeline.expand(pipeline, TextSamplingSpec.builder()
                        .inputPattern(inputPattern)
                        .request(request(count))
                        .cacheInput(cache)
                        .build());
                PAssert.that(graph.sampled()).containsInAnyOrder(asKvs(expected));
                pipeline.run().waitUntilFinish();
            }
        }
    }

    private static List<KV<String, String>> asKvs(Map<String, Set<String>> bySet) {
        List<KV<String, String>> kvs = new ArrayList<>();
        bySet.forEach((set, records) -> records.forEach(r -> kvs.add(KV.of(set, r))));
        return kvs;
    }

    @Test
    @DisplayName("Should expose refined thresholds without advisories")
    void testExpand_RefinedThresholds() {
        Pipeline pipeline = newPipeline();
        TextSamplingPipeline.SamplingGraph graph = TextSamplingPipeline.expand(pipeline, TextSamplingSpec.builder()
                .inputPattern(inputPattern)
                .request(request((long) FILES * LINES_PER_FILE))
                .build());
        assertEquals(Map.of("small", 100L, "quarter", 300L), graph.plan().targetSizes());
        PAssert.thatSingleton(graph.refined()).satisfies(refined -> {
            assertEquals(2, refined.finalThresholds().size());
            assertTrue(refined.advisories().isEmpty());
            assertTrue(refined.finalThresholds().get("small").high() <= refined.finalThresholds().get("quarter").low());
            return null;
        });
        pipeline.run().waitUntilFinish();
    }

    // ============================================================================
    // Configuration errors
    // ============================================================================

    @Test
    @DisplayName("Should fail while building the graph when the count makes sizes invalid")
    void testExpand_EagerPlanFailure() {
        SamplingRequest oversubscribed = SamplingRequest.builder()
                .setSize("a", 900.0).setSize("b", 900.0).count(1200L).seed(SEED).build();
        assertThrows(InvalidConfigurationException.class, () -> TextSamplingPipeline.expand(newPipeline(),
                TextSamplingSpec.builder().inputPattern(inputPattern).request(oversubscribed).build()));
    }

    @Test
    @DisplayName("Should surface a planning failure from the counted population when the pipeline runs")
    void testExpand_LazyPlanFailure() {
        SamplingRequest oversubscribed = SamplingRequest.builder()
                .setSize("a", 900.0).setSize("b", 900.0).seed(SEED).build();
        Pipeline pipeline = newPipeline();
        TextSamplingPipeline.expand(pipeline,
                TextSamplingSpec.builder().inputPattern(inputPattern).request(oversubscribed).build());
        Pipeline.PipelineExecutionException e = assertThrows(Pipeline.PipelineExecutionException.class,
                () -> pipeline.run().waitUntilFinish());
        assertInstanceOf(InvalidConfigurationException.class, e.getCause());
    }

    @Test
    @DisplayName("Should require a resolved seed and at least one set")
    void testExpand_InvalidSpec() {
        assertThrows(IllegalArgumentException.class, () -> TextSamplingPipeline.expand(newPipeline(),
                TextSamplingSpec.builder().inputPattern(inputPattern)
                        .request(SamplingRequest.builder().setSize("a", 1.0).build()).build()));
        assertThrows(InvalidConfigurationException.class, () -> TextSamplingPipeline.expand(newPipeline(),
                TextSamplingSpec.builder().inputPattern(inputPattern)
                        .request(SamplingRequest.builder().seed(1L).build()).build()));
    }

    @Test
    @DisplayName("Should index partitions by sorted file name")
    void testPartitionSource_ListSorted() {
        List<PartitionSource> sources = PartitionSource.list(inputPattern);
        assertEquals(FILES, sources.size());
        for (int i = 0; i < FILES; i++) {
            assertEquals(i, sources.get(i).getIndex());
            assertTrue(sources.get(i).getResourceId().endsWith("part-" + i + ".txt"));
        }
        assertTrue(PartitionSource.list(tempDir.resolve("in").resolve("none-*.txt").toString()).isEmpty());
    }
}
