package com.di.splitnova.sampling;

import java.io.Serializable;

/**
 * Pass-1 key intervals for one target set: {@code [low, accept)} is accepted outright,
 * {@code [accept, waitlistCutoff)} is waitlisted, everything else is outside the set.
 */
public record Threshold(double low, double accept, double waitlistCutoff) implements Serializable {

    public Threshold {
        if (!(0.0 <= low && low <= accept && accept <= waitlistCutoff && waitlistCutoff <= 1.0)) {
            throw new IllegalArgumentException(String.format(
                    "Threshold must satisfy 0 <= low <= accept <= waitlistCutoff <= 1, got (%s, %s, %s)",
                    low, accept, waitlistCutoff));
        }
    }

    /** Width of the key space reserved for this set. */
    public double width() {
        return waitlistCutoff - low;
    }
}
