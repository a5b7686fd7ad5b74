package com.di.splitnova.sampling;

import java.io.Serializable;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Pass 2. Replays the same key sequence as {@link PartitionClassifier} and labels each record
 * whose key falls inside a final interval. Sets are checked in plan order and the first match
 * wins. Records are produced lazily, so a partition is never held in memory.
 */
public final class PartitionMapper implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long seed;
    private final String[] names;
    private final double[] lows;
    private final double[] highs;

    public PartitionMapper(long seed, Map<String, FinalThreshold> finalThresholds) {
        this.seed = seed;
        int n = finalThresholds.size();
        this.names = new String[n];
        this.lows = new double[n];
        this.highs = new double[n];
        int i = 0;
        for (Map.Entry<String, FinalThreshold> e : finalThresholds.entrySet()) {
            names[i] = e.getKey();
            lows[i] = e.getValue().low();
            highs[i] = e.getValue().high();
            i++;
        }
    }

    /**
     * Returns the set name for the next key, or {@code null} if the record is not sampled.
     */
    String assign(double key) {
        for (int i = 0; i < names.length; i++) {
            if (key < lows[i]) {
                continue;
            }
            if (key < highs[i]) {
                return names[i];
            }
        }
        return null;
    }

    public <T> Iterator<SampledRecord<T>> map(int partitionIndex, Iterator<T> records) {
        RandomKeySequence keys = new RandomKeySequence(seed, partitionIndex);
        return new Iterator<>() {
            private SampledRecord<T> next;

            @Override
            public boolean hasNext() {
                while (next == null && records.hasNext()) {
                    T record = records.next();
                    String set = assign(keys.next());
                    if (set != null) {
                        next = new SampledRecord<>(set, record);
                    }
                }
                return next != null;
            }

            @Override
            public SampledRecord<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                SampledRecord<T> out = next;
                next = null;
                return out;
            }
        };
    }
}
