package com.di.splitnova.collection;

import java.io.Serializable;
import java.util.Iterator;

/**
 * Function applied once per partition, given the partition index and its records in order.
 */
@FunctionalInterface
public interface PartitionFunction<T, R> extends Serializable {

    Iterator<R> apply(int partitionIndex, Iterator<T> records);
}
