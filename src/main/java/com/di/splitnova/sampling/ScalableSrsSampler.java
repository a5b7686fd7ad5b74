package com.di.splitnova.sampling;

import com.di.splitnova.collection.PartitionedCollection;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;

/**
 * Two-pass exact-size simple random sampling over a {@link PartitionedCollection}.
 *
 * <ol>
 *   <li>Normalize set sizes and derive disjoint pass-1 thresholds.</li>
 *   <li>Pass 1: classify each partition into accept / waitlist / reject and reduce the tallies.</li>
 *   <li>Refine each set's upper bound from the global tally.</li>
 *   <li>Pass 2: replay the keys and label records that fall inside a final interval.</li>
 * </ol>
 *
 * <p>The seed is resolved once here and passed explicitly to every partition; partition code never
 * reads the clock.
 */
@Slf4j
public class ScalableSrsSampler {

    private final Clock clock;

    public ScalableSrsSampler() {
        this(Clock.systemUTC());
    }

    public ScalableSrsSampler(Clock clock) {
        this.clock = clock;
    }

    public <T> SamplingResult<T> sample(PartitionedCollection<T> input, SamplingRequest request) {
        long population = request.getCount() != null ? request.getCount() : input.count();
        long seed = request.resolveSeed(clock);
        SamplingPlan plan = SamplingPlan.create(request.getSetSizes(), population, request.getDelta(),
                seed, request.isReproportion());
        log.info("[SAMPLER] population={} partitions={} seed={} delta={} targets={}",
                population, input.partitionCount(), seed, plan.delta(), plan.targetSizes());

        PartitionClassifier classifier = new PartitionClassifier(plan);
        PartitionTally global = input.partitionCount() == 0
                ? PartitionTally.empty()
                : input.<PartitionTally>mapPartitionsWithIndex(
                        (idx, records) -> Collections.singletonList(classifier.classify(idx, records)).iterator())
                        .reduce(CountAggregator::merge);
        log.info("[SAMPLER] Pass 1 complete: {} candidate records", CountAggregator.candidateCount(global));

        RefinedThresholds refined = ThresholdRefiner.refine(global, plan);

        PartitionMapper mapper = new PartitionMapper(plan.seed(), refined.finalThresholds());
        PartitionedCollection<SampledRecord<T>> output = input.mapPartitionsWithIndex(mapper::map);
        return new SamplingResult<>(plan, global, refined.finalThresholds(), refined.advisories(), output);
    }
}
