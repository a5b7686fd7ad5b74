package com.di.splitnova.sampling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CountAggregator Tests")
class CountAggregatorTest {

    private static PartitionTally tally(String set, long accepted, double... keys) {
        return new PartitionTally(Map.of(set, new SetTally(accepted, keys)));
    }

    @Test
    @DisplayName("Should sum accepted counts and concatenate waitlists")
    void testMerge_SumsAndConcatenates() {
        PartitionTally merged = CountAggregator.merge(tally("a", 2, 0.1), tally("a", 3, 0.2, 0.3));
        assertEquals(5, merged.get("a").getAcceptedCount());
        assertArrayEquals(new double[]{0.1, 0.2, 0.3}, merged.get("a").getWaitlistedKeys());
    }

    @Test
    @DisplayName("Should keep sets present on only one side")
    void testMerge_DisjointSets() {
        PartitionTally merged = CountAggregator.merge(tally("a", 1), tally("b", 4, 0.7));
        assertEquals(1, merged.get("a").getAcceptedCount());
        assertEquals(4, merged.get("b").getAcceptedCount());
        assertEquals(1, merged.get("b").getWaitlistSize());
    }

    @Test
    @DisplayName("Should not modify its inputs")
    void testMerge_Pure() {
        PartitionTally left = tally("a", 2, 0.1);
        PartitionTally right = tally("a", 3, 0.2);
        CountAggregator.merge(left, right);
        assertEquals(tally("a", 2, 0.1), left);
        assertEquals(tally("a", 3, 0.2), right);
    }

    @Test
    @DisplayName("Should agree with folding merge regardless of grouping")
    void testAggregate_MatchesFold() {
        List<PartitionTally> parts = List.of(tally("a", 1, 0.5), tally("a", 2), tally("a", 0, 0.4, 0.45));
        PartitionTally folded = parts.stream().reduce(PartitionTally.empty(), CountAggregator::merge);
        PartitionTally regrouped = CountAggregator.merge(parts.get(0), CountAggregator.merge(parts.get(1), parts.get(2)));
        PartitionTally aggregated = CountAggregator.aggregate(parts);

        assertEquals(folded, aggregated);
        assertEquals(folded.get("a").getAcceptedCount(), regrouped.get("a").getAcceptedCount());
        double[] a = folded.get("a").getWaitlistedKeys().clone();
        double[] b = regrouped.get("a").getWaitlistedKeys().clone();
        Arrays.sort(a);
        Arrays.sort(b);
        assertArrayEquals(a, b);
    }

    @Test
    @DisplayName("Should count accepted plus waitlisted records")
    void testCandidateCount() {
        PartitionTally merged = CountAggregator.merge(tally("a", 2, 0.1), tally("b", 1, 0.2, 0.3));
        assertEquals(6, CountAggregator.candidateCount(merged));
        assertEquals(0, CountAggregator.candidateCount(CountAggregator.aggregate(List.of())));
    }
}
