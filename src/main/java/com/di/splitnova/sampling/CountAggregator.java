package com.di.splitnova.sampling;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds partition tallies into the global tally. Merging is associative and commutative up to the
 * order of waitlisted keys, which the refiner does not depend on.
 *
 * <p>This is a pure reduction: it never touches shared counters, so a substrate that re-runs a
 * partition and keeps one copy of its output cannot double count.
 */
public final class CountAggregator {

    private CountAggregator() {
    }

    /** Returns a new tally holding every set of {@code a} and {@code b}. Inputs are not modified. */
    public static PartitionTally merge(PartitionTally a, PartitionTally b) {
        Map<String, SetTally> merged = new LinkedHashMap<>(a.getSets());
        for (Map.Entry<String, SetTally> e : b.getSets().entrySet()) {
            SetTally existing = merged.get(e.getKey());
            merged.put(e.getKey(), existing == null ? e.getValue() : SetTally.merge(existing, e.getValue()));
        }
        return new PartitionTally(merged);
    }

    /**
     * Merges all tallies at once, copying every waitlist exactly one time. Equivalent to folding
     * {@link #merge} over the input.
     */
    public static PartitionTally aggregate(Iterable<PartitionTally> tallies) {
        Set<String> names = new LinkedHashSet<>();
        List<PartitionTally> all = new ArrayList<>();
        for (PartitionTally t : tallies) {
            all.add(t);
            names.addAll(t.getSets().keySet());
        }

        Map<String, SetTally> global = new LinkedHashMap<>();
        for (String name : names) {
            long accepted = 0;
            int waitlisted = 0;
            for (PartitionTally t : all) {
                SetTally s = t.get(name);
                accepted += s.getAcceptedCount();
                waitlisted += s.getWaitlistSize();
            }
            double[] keys = new double[waitlisted];
            int pos = 0;
            for (PartitionTally t : all) {
                double[] part = t.get(name).getWaitlistedKeys();
                System.arraycopy(part, 0, keys, pos, part.length);
                pos += part.length;
            }
            global.put(name, new SetTally(accepted, keys));
        }
        return new PartitionTally(global);
    }

    /** Total accepted plus waitlisted records across all sets; used for logging. */
    public static long candidateCount(PartitionTally tally) {
        return tally.getSets().values().stream()
                .mapToLong(s -> s.getAcceptedCount() + s.getWaitlistSize())
                .sum();
    }
}
