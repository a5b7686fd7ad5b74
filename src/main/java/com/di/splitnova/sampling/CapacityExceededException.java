package com.di.splitnova.sampling;

/**
 * Thrown when the disjoint key-space intervals reserved for the preceding target sets already
 * cover {@code [0, 1)}, leaving no room for the next set to start.
 */
public class CapacityExceededException extends SamplingException {

    private final double requiredWidth;

    public CapacityExceededException(String message, double requiredWidth) {
        super(message);
        this.requiredWidth = requiredWidth;
    }

    /** Cumulative key-space offset at the set that could not be placed. */
    public double getRequiredWidth() {
        return requiredWidth;
    }
}
