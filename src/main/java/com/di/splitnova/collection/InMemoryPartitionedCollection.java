package com.di.splitnova.collection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * {@link PartitionedCollection} backed by in-memory lists. Partition functions run independently
 * and in parallel on the common fork-join pool; results are assembled back in partition order.
 * Suitable for previews, single-node use and tests.
 */
public class InMemoryPartitionedCollection<T> implements PartitionedCollection<T> {

    private final List<List<T>> partitions;

    public InMemoryPartitionedCollection(List<List<T>> partitions) {
        if (partitions == null) {
            throw new IllegalArgumentException("partitions cannot be null");
        }
        List<List<T>> copy = new ArrayList<>(partitions.size());
        for (List<T> p : partitions) {
            copy.add(p == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(p)));
        }
        this.partitions = Collections.unmodifiableList(copy);
    }

    /**
     * Splits {@code records} into {@code partitionCount} contiguous chunks whose sizes differ by at
     * most one.
     */
    public static <T> InMemoryPartitionedCollection<T> of(List<T> records, int partitionCount) {
        if (partitionCount <= 0) {
            throw new IllegalArgumentException("partitionCount must be > 0");
        }
        int n = records.size();
        int base = n / partitionCount;
        int remainder = n % partitionCount;
        List<List<T>> parts = new ArrayList<>(partitionCount);
        int start = 0;
        for (int i = 0; i < partitionCount; i++) {
            int size = base + (i < remainder ? 1 : 0);
            parts.add(records.subList(start, start + size));
            start += size;
        }
        return new InMemoryPartitionedCollection<>(parts);
    }

    public List<T> partition(int index) {
        return partitions.get(index);
    }

    @Override
    public int partitionCount() {
        return partitions.size();
    }

    @Override
    public long count() {
        return partitions.stream().mapToLong(List::size).sum();
    }

    @Override
    public <R> PartitionedCollection<R> mapPartitionsWithIndex(PartitionFunction<T, R> fn) {
        List<List<R>> out = IntStream.range(0, partitions.size())
                .parallel()
                .mapToObj(i -> {
                    List<R> results = new ArrayList<>();
                    fn.apply(i, partitions.get(i).iterator()).forEachRemaining(results::add);
                    return results;
                })
                .collect(Collectors.toList());
        return new InMemoryPartitionedCollection<>(out);
    }

    @Override
    public T reduce(BinaryOperator<T> fn) {
        return partitions.stream()
                .flatMap(List::stream)
                .reduce(fn)
                .orElseThrow(() -> new IllegalStateException("Cannot reduce an empty collection"));
    }

    @Override
    public List<T> collect() {
        List<T> all = new ArrayList<>();
        partitions.forEach(all::addAll);
        return all;
    }
}
