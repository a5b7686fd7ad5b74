package com.di.splitnova.sampling;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Accepted count and waitlisted keys for one target set, either within a single partition or
 * summed over all of them.
 */
public final class SetTally implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final double[] NO_KEYS = new double[0];

    private final long acceptedCount;
    private final double[] waitlistedKeys;

    public SetTally(long acceptedCount, double[] waitlistedKeys) {
        if (acceptedCount < 0) {
            throw new IllegalArgumentException("acceptedCount must be >= 0, was " + acceptedCount);
        }
        this.acceptedCount = acceptedCount;
        this.waitlistedKeys = waitlistedKeys == null ? NO_KEYS : waitlistedKeys;
    }

    public static SetTally empty() {
        return new SetTally(0, NO_KEYS);
    }

    public long getAcceptedCount() {
        return acceptedCount;
    }

    /** Waitlisted keys in encounter order. The returned array is shared and must not be modified. */
    public double[] getWaitlistedKeys() {
        return waitlistedKeys;
    }

    public int getWaitlistSize() {
        return waitlistedKeys.length;
    }

    /** Sums the counts and concatenates the waitlists. Neither argument is modified. */
    public static SetTally merge(SetTally a, SetTally b) {
        double[] keys = Arrays.copyOf(a.waitlistedKeys, a.waitlistedKeys.length + b.waitlistedKeys.length);
        System.arraycopy(b.waitlistedKeys, 0, keys, a.waitlistedKeys.length, b.waitlistedKeys.length);
        return new SetTally(a.acceptedCount + b.acceptedCount, keys);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetTally)) return false;
        SetTally other = (SetTally) o;
        return acceptedCount == other.acceptedCount && Arrays.equals(waitlistedKeys, other.waitlistedKeys);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(acceptedCount) + Arrays.hashCode(waitlistedKeys);
    }

    @Override
    public String toString() {
        return "SetTally{accepted=" + acceptedCount + ", waitlisted=" + waitlistedKeys.length + "}";
    }
}
