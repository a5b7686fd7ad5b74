package com.di.splitnova.sampling;

import com.di.splitnova.collection.InMemoryPartitionedCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScalableSrsSampler Tests")
class ScalableSrsSamplerTest {

    private final ScalableSrsSampler sampler = new ScalableSrsSampler();

    private static InMemoryPartitionedCollection<Integer> population(int n, int partitions) {
        List<Integer> records = IntStream.range(0, n).boxed().collect(Collectors.toList());
        return InMemoryPartitionedCollection.of(records, partitions);
    }

    private static Map<String, List<Integer>> bySet(SamplingResult<Integer> result) {
        return result.output().collect().stream().collect(Collectors.groupingBy(SampledRecord::setName,
                Collectors.mapping(SampledRecord::record, Collectors.toList())));
    }

    @Test
    @DisplayName("Should draw exactly the requested number of records")
    void testSample_ExactSize() {
        SamplingResult<Integer> result = sampler.sample(population(1000, 4),
                SamplingRequest.builder().setSize("sample", 100.0).seed(42L).build());

        List<Integer> sample = bySet(result).get("sample");
        assertEquals(100, sample.size());
        assertEquals(100, new HashSet<>(sample).size());
        assertFalse(result.hasAdvisories());
        assertEquals(1000, result.plan().population());
    }

    @Test
    @DisplayName("Should draw disjoint sets of exact sizes")
    void testSample_MultipleDisjointSets() {
        SamplingRequest request = SamplingRequest.builder()
                .setSize("train", 0.6)
                .setSize("valid", 0.2)
                .setSize("test", 0.1)
                .seed(7L)
                .build();
        SamplingResult<Integer> result = sampler.sample(population(10_000, 8), request);
        Map<String, List<Integer>> sets = bySet(result);

        assertEquals(6000, sets.get("train").size());
        assertEquals(2000, sets.get("valid").size());
        assertEquals(1000, sets.get("test").size());

        Set<Integer> seen = new HashSet<>();
        sets.values().forEach(members -> members.forEach(r -> assertTrue(seen.add(r), "record " + r + " sampled twice")));
        assertEquals(9000, seen.size());
    }

    @Test
    @DisplayName("Should reproduce the same sample for the same seed")
    void testSample_Deterministic() {
        SamplingRequest request = SamplingRequest.builder().setSize("a", 0.05).seed(123L).build();
        List<SampledRecord<Integer>> first = sampler.sample(population(5000, 6), request).output().collect();
        List<SampledRecord<Integer>> second = sampler.sample(population(5000, 6), request).output().collect();
        assertEquals(first, second);

        List<SampledRecord<Integer>> otherSeed = sampler.sample(population(5000, 6),
                request.toBuilder().seed(124L).build()).output().collect();
        assertNotEquals(first, otherSeed);
    }

    @Test
    @DisplayName("Should keep records in partition order within each set")
    void testSample_PreservesOrder() {
        SamplingResult<Integer> result = sampler.sample(population(2000, 3),
                SamplingRequest.builder().setSize("a", 200.0).seed(5L).build());
        List<Integer> sample = bySet(result).get("a");
        for (int i = 1; i < sample.size(); i++) {
            assertTrue(sample.get(i - 1) < sample.get(i));
        }
    }

    @Test
    @DisplayName("Should use the given count instead of counting the input")
    void testSample_ExplicitCount() {
        SamplingResult<Integer> result = sampler.sample(population(1000, 2),
                SamplingRequest.builder().setSize("a", 0.1).count(1000L).seed(1L).build());
        assertEquals(100L, result.plan().targetSizes().get("a"));
        assertEquals(100, result.output().count());
    }

    @Test
    @DisplayName("Should seed from the clock when no seed is given")
    void testSample_ClockSeed() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
        SamplingResult<Integer> result = new ScalableSrsSampler(clock).sample(population(500, 2),
                SamplingRequest.builder().setSize("a", 10.0).build());
        assertEquals(1_700_000_000L, result.seed());
    }

    @Test
    @DisplayName("Should reject oversubscribed sets before reading any partition")
    void testSample_Oversubscribed() {
        assertThrows(InvalidConfigurationException.class, () -> sampler.sample(population(100, 2),
                SamplingRequest.builder().setSize("a", 80.0).setSize("b", 30.0).seed(1L).build()));
    }

    @Test
    @DisplayName("Should rescale oversubscribed sets and report the set clipped at the end of the key space")
    void testSample_ReproportionedSets() {
        SamplingResult<Integer> result = sampler.sample(population(1000, 4), SamplingRequest.builder()
                .setSize("train", 600.0)
                .setSize("test", 500.0)
                .reproportion(true)
                .seed(42L)
                .build());

        assertEquals(545L, result.plan().targetSizes().get("train"));
        assertEquals(454L, result.plan().targetSizes().get("test"));

        Map<String, List<Integer>> sets = bySet(result);
        assertEquals(545, sets.get("train").size());
        Set<Integer> train = new HashSet<>(sets.get("train"));
        sets.get("test").forEach(r -> assertFalse(train.contains(r), "record " + r + " in both sets"));

        assertEquals(1, result.advisories().size());
        SamplingAdvisory advisory = result.advisories().get(0);
        assertEquals("test", advisory.setName());
        assertEquals(AdvisoryType.WAITLIST_SHORT, advisory.type());
        assertEquals(advisory.expectedSize(), sets.get("test").size());
        assertTrue(sets.get("test").size() < 454);
    }

    @Test
    @DisplayName("Should fail when the sets do not fit in the key space")
    void testSample_CapacityExceeded() {
        assertThrows(CapacityExceededException.class, () -> sampler.sample(population(100, 2),
                SamplingRequest.builder()
                        .setSize("a", 25.0).setSize("b", 25.0).setSize("c", 25.0).setSize("d", 25.0)
                        .seed(1L).build()));
    }
}
