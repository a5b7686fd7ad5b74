package com.di.splitnova.sampling;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the global tally into exact final intervals.
 *
 * <p>For each set, {@code required = target - accepted}:
 * <ul>
 *   <li>{@code required <= 0}: keep {@code [low, accept)} and drop the whole waitlist;</li>
 *   <li>{@code required >= waitlist size}: keep {@code [low, waitlistCutoff)};</li>
 *   <li>otherwise: the {@code (required + 1)}-th smallest waitlisted key becomes the exclusive
 *       upper bound, admitting exactly {@code required} waitlisted records.</li>
 * </ul>
 *
 * <p>Exactness assumes waitlisted keys are distinct. Keys are 53-bit uniform doubles, so a tie
 * at the cutoff is very unlikely but not impossible; a tie would admit fewer records than required.
 */
@Slf4j
public final class ThresholdRefiner {

    private ThresholdRefiner() {
    }

    public static RefinedThresholds refine(PartitionTally global, SamplingPlan plan) {
        Map<String, FinalThreshold> finals = new LinkedHashMap<>();
        List<SamplingAdvisory> advisories = new ArrayList<>();

        for (Map.Entry<String, Long> e : plan.targetSizes().entrySet()) {
            String name = e.getKey();
            long target = e.getValue();
            Threshold threshold = plan.thresholds().get(name);
            SetTally tally = global.get(name);
            long accepted = tally.getAcceptedCount();
            double[] waitlist = tally.getWaitlistedKeys();
            long required = target - accepted;

            FinalThreshold result;
            if (required <= 0) {
                result = new FinalThreshold(threshold.low(), threshold.accept());
                if (required < 0) {
                    advisories.add(new SamplingAdvisory(name, AdvisoryType.TARGET_OVERSATISFIED,
                            target, accepted, waitlist.length, required));
                }
            } else if (required >= waitlist.length) {
                result = new FinalThreshold(threshold.low(), threshold.waitlistCutoff());
                if (required > waitlist.length) {
                    advisories.add(new SamplingAdvisory(name, AdvisoryType.WAITLIST_SHORT,
                            target, accepted, waitlist.length, required));
                }
            } else {
                double cutoff = OrderStatistics.kthSmallest(waitlist, (int) required + 1);
                result = new FinalThreshold(threshold.low(), cutoff);
            }
            finals.put(name, result);
            log.info("[REFINER] set={} target={} accepted={} waitlisted={} required={} final=[{}, {})",
                    name, target, accepted, waitlist.length, required, result.low(), result.high());
        }

        for (SamplingAdvisory advisory : advisories) {
            log.warn("[REFINER] Advisory {}: {}", advisory.type(), advisory.describe());
        }
        return new RefinedThresholds(Collections.unmodifiableMap(finals), Collections.unmodifiableList(advisories));
    }
}
