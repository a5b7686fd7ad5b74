package com.di.splitnova.sampling;

import java.io.Serializable;
import java.util.Map;

/**
 * Everything pass 1 needs, computed once on the driver: the normalized target sizes and the
 * offset-allocated thresholds, together with the population and seed they were derived from.
 * Shipped unchanged to every partition.
 */
public record SamplingPlan(long population,
                           long seed,
                           double delta,
                           Map<String, Long> targetSizes,
                           Map<String, Threshold> thresholds) implements Serializable {

    /**
     * Normalizes {@code requestedSizes} against {@code population} and derives the pass-1
     * thresholds.
     *
     * @throws InvalidConfigurationException if the sizes or delta are invalid
     * @throws CapacityExceededException     if the sets do not fit in the key space
     */
    public static SamplingPlan create(Map<String, Double> requestedSizes, long population, double delta,
                                      long seed, boolean reproportion) {
        ThresholdCalculator.validateDelta(delta);
        Map<String, Long> sizes = SetSizeNormalizer.normalize(requestedSizes, population, reproportion);
        Map<String, Threshold> thresholds = ThresholdCalculator.initialThresholds(sizes, population, delta);
        return new SamplingPlan(population, seed, delta, sizes, thresholds);
    }
}
