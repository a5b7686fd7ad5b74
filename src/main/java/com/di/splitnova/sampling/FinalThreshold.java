package com.di.splitnova.sampling;

import java.io.Serializable;

/**
 * Final accept interval {@code [low, high)} for one target set, used by pass 2.
 */
public record FinalThreshold(double low, double high) implements Serializable {

    public FinalThreshold {
        if (!(0.0 <= low && low <= high && high <= 1.0)) {
            throw new IllegalArgumentException(String.format(
                    "FinalThreshold must satisfy 0 <= low <= high <= 1, got (%s, %s)", low, high));
        }
    }

    public boolean contains(double key) {
        return low <= key && key < high;
    }
}
