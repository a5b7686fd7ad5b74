package com.di.splitnova.pipeline;

import com.di.splitnova.sampling.CountAggregator;
import com.di.splitnova.sampling.PartitionTally;
import org.apache.beam.sdk.coders.Coder;
import org.apache.beam.sdk.coders.CoderRegistry;
import org.apache.beam.sdk.coders.ListCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.transforms.Combine;

import java.util.ArrayList;
import java.util.List;

/**
 * Global reduce of partition tallies. Accumulators only collect tallies; the waitlists are
 * concatenated once in {@link #extractOutput}. This is the barrier between the two passes.
 */
public class TallyCombineFn extends Combine.CombineFn<PartitionTally, List<PartitionTally>, PartitionTally> {

    @Override
    public List<PartitionTally> createAccumulator() {
        return new ArrayList<>();
    }

    @Override
    public List<PartitionTally> addInput(List<PartitionTally> accumulator, PartitionTally input) {
        accumulator.add(input);
        return accumulator;
    }

    @Override
    public List<PartitionTally> mergeAccumulators(Iterable<List<PartitionTally>> accumulators) {
        List<PartitionTally> merged = new ArrayList<>();
        for (List<PartitionTally> acc : accumulators) {
            merged.addAll(acc);
        }
        return merged;
    }

    @Override
    public PartitionTally extractOutput(List<PartitionTally> accumulator) {
        return CountAggregator.aggregate(accumulator);
    }

    @Override
    public Coder<List<PartitionTally>> getAccumulatorCoder(CoderRegistry registry, Coder<PartitionTally> inputCoder) {
        return ListCoder.of(SerializableCoder.of(PartitionTally.class));
    }

    @Override
    public Coder<PartitionTally> getDefaultOutputCoder(CoderRegistry registry, Coder<PartitionTally> inputCoder) {
        return SerializableCoder.of(PartitionTally.class);
    }
}
