package com.di.splitnova.sampling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrderStatistics Tests")
class OrderStatisticsTest {

    @Test
    @DisplayName("Should return the k-th smallest value")
    void testKthSmallest_Basic() {
        double[] values = {0.5, 0.1, 0.9, 0.3, 0.7};
        assertEquals(0.1, OrderStatistics.kthSmallest(values, 1));
        assertEquals(0.3, OrderStatistics.kthSmallest(values, 2));
        assertEquals(0.5, OrderStatistics.kthSmallest(values, 3));
        assertEquals(0.9, OrderStatistics.kthSmallest(values, 5));
    }

    @Test
    @DisplayName("Should not modify the input array")
    void testKthSmallest_InputUntouched() {
        double[] values = {0.4, 0.2, 0.8};
        double[] copy = values.clone();
        OrderStatistics.kthSmallest(values, 2);
        assertArrayEquals(copy, values);
    }

    @Test
    @DisplayName("Should agree with a full sort on random input")
    void testKthSmallest_MatchesSort() {
        Random random = new Random(7);
        double[] values = new double[2000];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextDouble();
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        for (int k : new int[]{1, 17, 1000, 1999, 2000}) {
            assertEquals(sorted[k - 1], OrderStatistics.kthSmallest(values, k));
        }
    }

    @Test
    @DisplayName("Should reject k outside [1, n]")
    void testKthSmallest_InvalidK() {
        double[] values = {0.1, 0.2};
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.kthSmallest(values, 0));
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.kthSmallest(values, 3));
        assertThrows(IllegalArgumentException.class, () -> OrderStatistics.kthSmallest(new double[0], 1));
    }
}
