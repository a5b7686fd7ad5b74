package com.di.splitnova.sampling;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pass 1. Replays the partition's key sequence and buckets every record into accept, waitlist or
 * reject for each target set. The result depends only on the seed, the partition index, the number
 * of records and the thresholds, so a re-executed partition produces an identical tally.
 */
public final class PartitionClassifier implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long seed;
    private final String[] names;
    private final double[] lows;
    private final double[] accepts;
    private final double[] cutoffs;

    public PartitionClassifier(long seed, Map<String, Threshold> thresholds) {
        this.seed = seed;
        int n = thresholds.size();
        this.names = new String[n];
        this.lows = new double[n];
        this.accepts = new double[n];
        this.cutoffs = new double[n];
        int i = 0;
        for (Map.Entry<String, Threshold> e : thresholds.entrySet()) {
            names[i] = e.getKey();
            lows[i] = e.getValue().low();
            accepts[i] = e.getValue().accept();
            cutoffs[i] = e.getValue().waitlistCutoff();
            i++;
        }
    }

    public PartitionClassifier(SamplingPlan plan) {
        this(plan.seed(), plan.thresholds());
    }

    public PartitionTally classify(int partitionIndex, Iterator<?> records) {
        RandomKeySequence keys = new RandomKeySequence(seed, partitionIndex);
        long[] accepted = new long[names.length];
        KeyBuffer[] waitlists = new KeyBuffer[names.length];
        for (int i = 0; i < waitlists.length; i++) {
            waitlists[i] = new KeyBuffer();
        }

        while (records.hasNext()) {
            records.next();
            double key = keys.next();
            for (int i = 0; i < names.length; i++) {
                if (key < lows[i]) {
                    continue;
                }
                if (key < accepts[i]) {
                    accepted[i]++;
                    break;
                }
                if (key < cutoffs[i]) {
                    waitlists[i].add(key);
                    break;
                }
            }
        }

        Map<String, SetTally> sets = new LinkedHashMap<>();
        for (int i = 0; i < names.length; i++) {
            sets.put(names[i], new SetTally(accepted[i], waitlists[i].toArray()));
        }
        return new PartitionTally(sets);
    }

    /** Growable primitive buffer; avoids boxing every waitlisted key. */
    private static final class KeyBuffer {
        private double[] keys = new double[16];
        private int size;

        void add(double key) {
            if (size == keys.length) {
                keys = Arrays.copyOf(keys, size * 2);
            }
            keys[size++] = key;
        }

        double[] toArray() {
            return Arrays.copyOf(keys, size);
        }
    }
}
