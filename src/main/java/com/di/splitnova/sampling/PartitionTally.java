package com.di.splitnova.sampling;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-set tallies produced by classifying one partition. After aggregation the same type holds
 * the global tally.
 */
public final class PartitionTally implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, SetTally> sets;

    public PartitionTally(Map<String, SetTally> sets) {
        this.sets = Collections.unmodifiableMap(new LinkedHashMap<>(sets));
    }

    public static PartitionTally empty() {
        return new PartitionTally(Collections.emptyMap());
    }

    public Map<String, SetTally> getSets() {
        return sets;
    }

    /** Tally for {@code setName}, or an empty tally when no record was classified into it. */
    public SetTally get(String setName) {
        SetTally tally = sets.get(setName);
        return tally != null ? tally : SetTally.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionTally)) return false;
        return sets.equals(((PartitionTally) o).sets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sets);
    }

    @Override
    public String toString() {
        return "PartitionTally" + sets;
    }
}
