package com.di.splitnova.sampling;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives the pass-1 thresholds from one-sided Chernoff/Bernstein bounds.
 *
 * <p>With probability at least {@code 1 - delta} fewer than {@code size} keys fall below
 * {@code qLow} and at least {@code size} keys fall below {@code qHigh}, so the waitlist between the
 * two always holds enough records to trim the sample to its exact size.
 *
 * <p>Multiple sets are laid out back to back in {@code [0, 1)}: set {@code i} starts where the
 * waitlist zone of set {@code i-1} ends. See Meng, "Scalable Simple Random Sampling and Stratified
 * Sampling", ICML 2013.
 */
@Slf4j
public final class ThresholdCalculator {

    public static final double DEFAULT_DELTA = 5e-5;

    private ThresholdCalculator() {
    }

    /**
     * @param ratio      sampling ratio {@code p = size / N}
     * @param population {@code N}
     * @param delta      error bound, in {@code (0, 1)}
     */
    public static ThresholdBounds computeBounds(double ratio, long population, double delta) {
        validateDelta(delta);
        if (population <= 0) {
            throw new InvalidConfigurationException("Population must be positive, was " + population);
        }
        double logDelta = Math.log(delta);
        double gamma1 = -logDelta / population;
        double gamma2 = -(2.0 * logDelta) / (3.0 * population);

        double qLow = Math.max(0.0, ratio + gamma2 - Math.sqrt(gamma2 * gamma2 + 3.0 * gamma2 * ratio));
        double qHigh = Math.min(1.0, ratio + gamma1 + Math.sqrt(gamma1 * gamma1 + 2.0 * gamma1 * ratio));
        return new ThresholdBounds(qLow, qHigh);
    }

    /**
     * Allocates disjoint key intervals for every set, in the iteration order of {@code targetSizes}.
     *
     * <p>A set starting near the end of the key space keeps its start and has its accept and
     * waitlist cutoffs clipped to 1.0. Such a set may come out short; the refiner reports it as
     * {@link AdvisoryType#WAITLIST_SHORT}.
     *
     * @throws CapacityExceededException if a set would start at or beyond 1.0
     */
    public static Map<String, Threshold> initialThresholds(Map<String, Long> targetSizes, long population, double delta) {
        Map<String, Threshold> thresholds = new LinkedHashMap<>();
        double offset = 0.0;
        for (Map.Entry<String, Long> e : targetSizes.entrySet()) {
            if (offset >= 1.0) {
                throw new CapacityExceededException(String.format(
                        "Key space exhausted at set '%s': cumulative offset %.6f reaches 1.0. "
                                + "Request fewer or smaller sets, or a larger delta.", e.getKey(), offset), offset);
            }
            ThresholdBounds bounds = computeBounds((double) e.getValue() / population, population, delta);
            double end = offset + bounds.qHigh();
            Threshold threshold = new Threshold(offset, Math.min(1.0, offset + bounds.qLow()), Math.min(1.0, end));
            if (end > 1.0) {
                log.warn("[THRESHOLDS] set={} waitlist clipped at 1.0 (unclipped end {}), sample may be short",
                        e.getKey(), end);
            }
            thresholds.put(e.getKey(), threshold);
            log.debug("[THRESHOLDS] set={} size={} threshold={}", e.getKey(), e.getValue(), threshold);
            offset = end;
        }
        return Collections.unmodifiableMap(thresholds);
    }

    static void validateDelta(double delta) {
        if (!(delta > 0.0 && delta < 1.0)) {
            throw new InvalidConfigurationException("delta must be in (0, 1), was " + delta);
        }
    }
}
