package com.di.splitnova.service;

import com.di.splitnova.config.SamplingProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link SamplingRunStore} bounded by {@code splitnova.sampling.run-history-size};
 * the oldest run is evicted when the bound is reached.
 */
@Component
public class InMemorySamplingRunStore implements SamplingRunStore {

    private final int capacity;
    private final Map<String, SamplingRun> byRunId = new ConcurrentHashMap<>();
    private final Deque<SamplingRun> insertionOrder = new ArrayDeque<>();

    public InMemorySamplingRunStore(SamplingProperties properties) {
        this.capacity = Math.max(1, properties.getRunHistorySize());
    }

    @Override
    public String save(SamplingRun run) {
        if (run == null || run.getRunId() == null) return null;
        synchronized (insertionOrder) {
            insertionOrder.addLast(run);
            byRunId.put(run.getRunId(), run);
            while (insertionOrder.size() > capacity) {
                SamplingRun evicted = insertionOrder.removeFirst();
                byRunId.remove(evicted.getRunId());
            }
        }
        return run.getRunId();
    }

    @Override
    public Optional<SamplingRun> findByRunId(String runId) {
        return runId == null ? Optional.empty() : Optional.ofNullable(byRunId.get(runId));
    }

    @Override
    public List<SamplingRun> findRecent(int limit) {
        List<SamplingRun> out = new ArrayList<>();
        synchronized (insertionOrder) {
            Iterator<SamplingRun> newestFirst = insertionOrder.descendingIterator();
            while (newestFirst.hasNext() && out.size() < limit) {
                out.add(newestFirst.next());
            }
        }
        return out;
    }
}
