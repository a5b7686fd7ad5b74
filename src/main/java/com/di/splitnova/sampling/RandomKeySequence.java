package com.di.splitnova.sampling;

import java.util.Random;

/**
 * Deterministic stream of uniform keys in {@code [0, 1)} for one partition.
 *
 * <p>The generator is seeded with {@code seed + partitionIndex} and yields one key per record in
 * record order. Constructing a new sequence for the same pair replays the same keys, which is what
 * lets pass 2 (and any re-executed task) rebuild pass-1 keys without storing them.
 */
public final class RandomKeySequence {

    private final Random random;

    public RandomKeySequence(long seed, int partitionIndex) {
        this.random = new Random(seed + partitionIndex);
    }

    public double next() {
        return random.nextDouble();
    }
}
