package com.di.splitnova.sampling;

import java.util.Collections;
import java.util.PriorityQueue;

/**
 * Partial selection over unsorted keys.
 */
public final class OrderStatistics {

    private OrderStatistics() {
    }

    /**
     * Returns the {@code k}-th smallest value (1-based) of {@code values} without sorting them.
     * Keeps a max-heap of the {@code k} smallest values seen so far: {@code O(n log k)} time and
     * {@code O(k)} extra space.
     *
     * @throws IllegalArgumentException if {@code k} is not in {@code [1, values.length]}
     */
    public static double kthSmallest(double[] values, int k) {
        if (k < 1 || k > values.length) {
            throw new IllegalArgumentException("k must be in [1, " + values.length + "], was " + k);
        }
        PriorityQueue<Double> heap = new PriorityQueue<>(k, Collections.reverseOrder());
        for (double v : values) {
            if (heap.size() < k) {
                heap.offer(v);
            } else if (v < heap.peek()) {
                heap.poll();
                heap.offer(v);
            }
        }
        return heap.peek();
    }
}
