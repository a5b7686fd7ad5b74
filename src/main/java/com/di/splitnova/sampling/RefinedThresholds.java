package com.di.splitnova.sampling;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link ThresholdRefiner}: the final interval per set, in the same order as the plan,
 * and any advisories raised while computing them.
 */
public record RefinedThresholds(Map<String, FinalThreshold> finalThresholds,
                                List<SamplingAdvisory> advisories) implements Serializable {
}
