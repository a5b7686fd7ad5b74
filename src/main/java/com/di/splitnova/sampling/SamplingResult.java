package com.di.splitnova.sampling;

import com.di.splitnova.collection.PartitionedCollection;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link ScalableSrsSampler#sample}: the sampled records keyed by set name, plus the
 * plan and thresholds needed to reproduce or audit the run.
 */
public record SamplingResult<T>(SamplingPlan plan,
                                PartitionTally globalTally,
                                Map<String, FinalThreshold> finalThresholds,
                                List<SamplingAdvisory> advisories,
                                PartitionedCollection<SampledRecord<T>> output) {

    public long seed() {
        return plan.seed();
    }

    public boolean hasAdvisories() {
        return !advisories.isEmpty();
    }
}
