package com.di.splitnova.sampling;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts requested set sizes into absolute record counts against the population.
 *
 * <p>Sizes below {@code 1.0} are ratios and become {@code round(size * N)}; anything else is taken
 * as an absolute count. When the counts add up to more than {@code N} they are either scaled down
 * by {@code N / sum} (reproportioning, floored) or rejected.
 */
@Slf4j
public final class SetSizeNormalizer {

    private SetSizeNormalizer() {
    }

    /**
     * @param requested    set name to ratio-or-count, in output order
     * @param population   population size {@code N}
     * @param reproportion scale sizes down instead of failing when oversubscribed
     * @return set name to absolute target size, same order, summing to at most {@code N}
     * @throws InvalidConfigurationException if oversubscribed and {@code reproportion} is off
     */
    public static Map<String, Long> normalize(Map<String, Double> requested, long population, boolean reproportion) {
        if (requested == null || requested.isEmpty()) {
            throw new InvalidConfigurationException("At least one target set is required");
        }
        if (population <= 0) {
            throw new InvalidConfigurationException("Population must be positive, was " + population);
        }

        Map<String, Long> absolute = new LinkedHashMap<>();
        long sum = 0;
        for (Map.Entry<String, Double> e : requested.entrySet()) {
            TargetSetSpec spec = new TargetSetSpec(e.getKey(), e.getValue() == null ? Double.NaN : e.getValue());
            long size = spec.isRatio() ? Math.round(spec.size() * population) : (long) spec.size();
            absolute.put(spec.name(), size);
            sum += size;
        }

        if (sum > population) {
            if (!reproportion) {
                throw new InvalidConfigurationException(String.format(
                        "Sum of sampled set sizes (%d) is larger than the population (%d); enable reproportion to scale them down",
                        sum, population));
            }
            double scale = (double) population / (double) sum;
            Map<String, Long> scaled = new LinkedHashMap<>();
            for (Map.Entry<String, Long> e : absolute.entrySet()) {
                scaled.put(e.getKey(), (long) (e.getValue() * scale));
            }
            log.info("[NORMALIZER] Reproportioned set sizes {} -> {} (population={})", absolute, scaled, population);
            absolute = scaled;
        }
        return Collections.unmodifiableMap(absolute);
    }
}
