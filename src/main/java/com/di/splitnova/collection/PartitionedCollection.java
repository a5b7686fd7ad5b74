package com.di.splitnova.collection;

import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Minimal view of a partitioned dataset, as consumed by the sampler. Implementations decide where
 * and how partitions run; the sampler only requires that each partition is presented in a stable
 * record order and that reductions keep one result per partition.
 */
public interface PartitionedCollection<T> {

    int partitionCount();

    /** Total number of records across all partitions. */
    long count();

    /**
     * Applies {@code fn} to every partition. Partition {@code i} of the result holds the output of
     * {@code fn} for partition {@code i} of this collection.
     */
    <R> PartitionedCollection<R> mapPartitionsWithIndex(PartitionFunction<T, R> fn);

    /**
     * Reduces all records with an associative, commutative operator.
     *
     * @throws IllegalStateException if the collection is empty
     */
    T reduce(BinaryOperator<T> fn);

    /** All records, partition by partition, in record order. */
    List<T> collect();
}
