package com.di.splitnova.sampling;

import java.io.Serializable;

/**
 * A reported, non-fatal deviation from the exact target size of one set. Both kinds are rare by
 * construction of the thresholds (probability at most {@code delta}) but are always surfaced.
 *
 * @param required records still required after pass 1 ({@code target - accepted}); negative when over-filled
 */
public record SamplingAdvisory(String setName,
                               AdvisoryType type,
                               long target,
                               long accepted,
                               int waitlisted,
                               long required) implements Serializable {

    /** Number of records the set will actually contain after pass 2. */
    public long expectedSize() {
        return type == AdvisoryType.WAITLIST_SHORT ? accepted + waitlisted : accepted;
    }

    public String describe() {
        if (type == AdvisoryType.WAITLIST_SHORT) {
            return String.format("set '%s' under-filled: %d required from waitlist but only %d waitlisted (%d of %d)",
                    setName, required, waitlisted, expectedSize(), target);
        }
        return String.format("set '%s' over-filled: pass 1 accepted %d for a target of %d",
                setName, accepted, target);
    }
}
