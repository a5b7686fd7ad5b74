package com.di.splitnova.pipeline;

import com.di.splitnova.sampling.AdvisoryType;
import com.di.splitnova.sampling.InvalidConfigurationException;
import com.di.splitnova.sampling.PartitionClassifier;
import com.di.splitnova.sampling.PartitionMapper;
import com.di.splitnova.sampling.PartitionTally;
import com.di.splitnova.sampling.RefinedThresholds;
import com.di.splitnova.sampling.SampledRecord;
import com.di.splitnova.sampling.SamplingAdvisory;
import com.di.splitnova.sampling.SamplingPlan;
import com.di.splitnova.sampling.SamplingRequest;
import com.di.splitnova.sampling.ThresholdRefiner;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.Partition;
import org.apache.beam.sdk.transforms.Sum;
import org.apache.beam.sdk.transforms.Values;
import org.apache.beam.sdk.transforms.View;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionList;
import org.apache.beam.sdk.values.PCollectionView;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the two-pass sampling graph over newline-delimited files.
 *
 * <pre>
 * ListPartitions -> [CachePartitions] -> [CountRecords] -> PlanSampling (side input)
 *   -> ClassifyPartitions -> AggregateTallies -> RefineThresholds (side input)
 *   -> MapPartitions -> SplitBySet -> Write-&lt;set&gt;
 * </pre>
 *
 * <p>Each file is one partition and is processed sequentially by a single DoFn call, which keeps
 * the per-partition key sequence aligned with record order. Pass 2 cannot start before the refined
 * thresholds side input is materialized, which happens only after every partition tally has been
 * combined.
 */
@Slf4j
public final class TextSamplingPipeline {

    public static final String METRICS_NAMESPACE = "splitnova";
    public static final String RECORDS_CLASSIFIED = "records_classified";
    public static final String RECORDS_SAMPLED = "records_sampled";
    public static final String SAMPLED_PREFIX = "sampled_";
    public static final String ADVISORY_PREFIX = "advisory_";
    public static final String PLANNED_POPULATION = "planned_population";
    public static final String TARGET_PREFIX = "target_";

    private TextSamplingPipeline() {
    }

    /**
     * Handles to the interesting parts of an expanded graph.
     *
     * @param plan the plan when it was computed while building the graph, {@code null} when it is
     *             computed from the counted population at run time
     */
    public record SamplingGraph(int partitionCount,
                                List<String> setNames,
                                SamplingPlan plan,
                                PCollection<RefinedThresholds> refined,
                                PCollection<KV<String, String>> sampled) {
    }

    /**
     * Adds the sampling graph to {@code pipeline}. When the population count is supplied the plan
     * is computed here, so configuration errors surface before the pipeline runs.
     */
    public static SamplingGraph expand(Pipeline pipeline, TextSamplingSpec spec) {
        SamplingRequest request = spec.getRequest();
        if (request == null || request.getSeed() == null) {
            throw new IllegalArgumentException("TextSamplingSpec requires a request with a resolved seed");
        }
        if (request.getSetSizes().isEmpty()) {
            throw new InvalidConfigurationException("At least one target set is required");
        }
        FileSystems.setDefaultPipelineOptions(pipeline.getOptions());

        List<PartitionSource> sources = PartitionSource.list(spec.getInputPattern());
        log.info("[PIPELINE] input={} partitions={} cacheInput={}", spec.getInputPattern(), sources.size(), spec.isCacheInput());

        PCollection<PartitionSource> partitions = pipeline.apply("ListPartitions",
                Create.of(sources).withCoder(SerializableCoder.of(PartitionSource.class)));
        if (spec.isCacheInput()) {
            partitions = partitions.apply("CachePartitions", ParDo.of(new CachePartitionFn()))
                    .setCoder(SerializableCoder.of(PartitionSource.class));
        }

        PCollection<SamplingPlan> plan;
        SamplingPlan eager = null;
        if (request.getCount() != null) {
            eager = SamplingPlan.create(request.getSetSizes(), request.getCount(),
                    request.getDelta(), request.getSeed(), request.isReproportion());
            plan = pipeline.apply("PlanSampling", Create.of(eager).withCoder(SerializableCoder.of(SamplingPlan.class)));
        } else {
            plan = partitions
                    .apply("CountRecords", ParDo.of(new CountPartitionFn()))
                    .apply("SumCounts", Sum.longsGlobally())
                    .apply("PlanSampling", ParDo.of(new PlanFromCountFn(request)))
                    .setCoder(SerializableCoder.of(SamplingPlan.class));
        }
        PCollectionView<SamplingPlan> planView = plan.apply("PlanView", View.asSingleton());

        PCollection<RefinedThresholds> refined = partitions
                .apply("ClassifyPartitions", ParDo.of(new ClassifyPartitionFn(planView)).withSideInputs(planView))
                .setCoder(SerializableCoder.of(PartitionTally.class))
                .apply("AggregateTallies", Combine.globally(new TallyCombineFn()))
                .apply("RefineThresholds", ParDo.of(new RefineThresholdsFn(planView)).withSideInputs(planView))
                .setCoder(SerializableCoder.of(RefinedThresholds.class));
        PCollectionView<RefinedThresholds> refinedView = refined.apply("RefinedView", View.asSingleton());

        PCollection<KV<String, String>> sampled = partitions
                .apply("MapPartitions", ParDo.of(new MapPartitionFn(planView, refinedView))
                        .withSideInputs(planView, refinedView))
                .setCoder(KvCoder.of(StringUtf8Coder.of(), StringUtf8Coder.of()));

        List<String> setNames = new ArrayList<>(request.getSetSizes().keySet());
        if (spec.getOutputDir() != null && !spec.getOutputDir().isBlank()) {
            writeSets(sampled, setNames, spec.getOutputDir());
        }
        return new SamplingGraph(sources.size(), setNames, eager, refined, sampled);
    }

    private static void writeSets(PCollection<KV<String, String>> sampled, List<String> setNames, String outputDir) {
        String root = outputDir.endsWith("/") ? outputDir : outputDir + "/";
        PCollectionList<KV<String, String>> bySet =
                sampled.apply("SplitBySet", Partition.of(setNames.size(), new SetPartitionFn(setNames)));
        for (int i = 0; i < setNames.size(); i++) {
            String name = setNames.get(i);
            bySet.get(i)
                    .apply("Records-" + name, Values.create())
                    .apply("Write-" + name, TextIO.write().to(root + name + "/part").withSuffix(".txt"));
        }
    }

    /* ------------------------------------------------------------------ */
    /* DoFns                                                                */
    /* ------------------------------------------------------------------ */

    public static class CachePartitionFn extends DoFn<PartitionSource, PartitionSource> {

        @ProcessElement
        public void process(@Element PartitionSource source, OutputReceiver<PartitionSource> out) throws IOException {
            out.output(source.withCachedLines());
        }
    }

    public static class CountPartitionFn extends DoFn<PartitionSource, Long> {

        @ProcessElement
        public void process(@Element PartitionSource source, OutputReceiver<Long> out) throws IOException {
            long n = 0;
            try (PartitionSource.RecordIterator records = source.open()) {
                while (records.hasNext()) {
                    records.next();
                    n++;
                }
            }
            out.output(n);
        }
    }

    /**
     * Normalizes and plans once the population has been counted. The planned population and target
     * sizes are reported as counters so the driver can read them back without re-planning.
     */
    public static class PlanFromCountFn extends DoFn<Long, SamplingPlan> {

        private final LinkedHashMap<String, Double> setSizes;
        private final double delta;
        private final long seed;
        private final boolean reproportion;

        public PlanFromCountFn(SamplingRequest request) {
            this.setSizes = new LinkedHashMap<>(request.getSetSizes());
            this.delta = request.getDelta();
            this.seed = request.getSeed();
            this.reproportion = request.isReproportion();
        }

        @ProcessElement
        public void process(@Element Long population, OutputReceiver<SamplingPlan> out) {
            SamplingPlan plan = SamplingPlan.create(setSizes, population, delta, seed, reproportion);
            Metrics.counter(METRICS_NAMESPACE, PLANNED_POPULATION).inc(plan.population());
            plan.targetSizes().forEach((name, size) -> Metrics.counter(METRICS_NAMESPACE, TARGET_PREFIX + name).inc(size));
            out.output(plan);
        }
    }

    public static class ClassifyPartitionFn extends DoFn<PartitionSource, PartitionTally> {

        private final Counter classified = Metrics.counter(METRICS_NAMESPACE, RECORDS_CLASSIFIED);
        private final PCollectionView<SamplingPlan> planView;

        public ClassifyPartitionFn(PCollectionView<SamplingPlan> planView) {
            this.planView = planView;
        }

        @ProcessElement
        public void process(ProcessContext c) throws IOException {
            PartitionSource source = c.element();
            PartitionClassifier classifier = new PartitionClassifier(c.sideInput(planView));
            try (PartitionSource.RecordIterator records = source.open()) {
                CountingIterator<String> counting = new CountingIterator<>(records);
                c.output(classifier.classify(source.getIndex(), counting));
                classified.inc(counting.count);
            }
        }
    }

    public static class RefineThresholdsFn extends DoFn<PartitionTally, RefinedThresholds> {

        private final PCollectionView<SamplingPlan> planView;

        public RefineThresholdsFn(PCollectionView<SamplingPlan> planView) {
            this.planView = planView;
        }

        @ProcessElement
        public void process(ProcessContext c) {
            RefinedThresholds refined = ThresholdRefiner.refine(c.element(), c.sideInput(planView));
            for (SamplingAdvisory advisory : refined.advisories()) {
                Metrics.counter(METRICS_NAMESPACE, advisoryCounterName(advisory.type())).inc();
            }
            c.output(refined);
        }
    }

    public static class MapPartitionFn extends DoFn<PartitionSource, KV<String, String>> {

        private final Counter sampledTotal = Metrics.counter(METRICS_NAMESPACE, RECORDS_SAMPLED);
        private final PCollectionView<SamplingPlan> planView;
        private final PCollectionView<RefinedThresholds> refinedView;
        private transient Map<String, Counter> perSet;

        public MapPartitionFn(PCollectionView<SamplingPlan> planView, PCollectionView<RefinedThresholds> refinedView) {
            this.planView = planView;
            this.refinedView = refinedView;
        }

        @Setup
        public void setup() {
            perSet = new HashMap<>();
        }

        @ProcessElement
        public void process(ProcessContext c) throws IOException {
            PartitionSource source = c.element();
            SamplingPlan plan = c.sideInput(planView);
            PartitionMapper mapper = new PartitionMapper(plan.seed(), c.sideInput(refinedView).finalThresholds());
            try (PartitionSource.RecordIterator records = source.open()) {
                Iterator<SampledRecord<String>> labelled = mapper.map(source.getIndex(), records);
                while (labelled.hasNext()) {
                    SampledRecord<String> r = labelled.next();
                    c.output(KV.of(r.setName(), r.record()));
                    sampledTotal.inc();
                    perSet.computeIfAbsent(r.setName(),
                            name -> Metrics.counter(METRICS_NAMESPACE, SAMPLED_PREFIX + name)).inc();
                }
            }
        }
    }

    /** Routes each labelled record to the output of its set. */
    public static class SetPartitionFn implements Partition.PartitionFn<KV<String, String>> {

        private final List<String> setNames;

        public SetPartitionFn(List<String> setNames) {
            this.setNames = new ArrayList<>(setNames);
        }

        @Override
        public int partitionFor(KV<String, String> elem, int numPartitions) {
            int i = setNames.indexOf(elem.getKey());
            if (i < 0) {
                throw new IllegalStateException("Record labelled with unknown set '" + elem.getKey() + "'");
            }
            return i;
        }
    }

    public static String advisoryCounterName(AdvisoryType type) {
        return ADVISORY_PREFIX + type.name().toLowerCase();
    }

    private static final class CountingIterator<T> implements Iterator<T> {
        private final Iterator<T> delegate;
        private long count;

        CountingIterator(Iterator<T> delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public T next() {
            T next = delegate.next();
            count++;
            return next;
        }
    }
}
