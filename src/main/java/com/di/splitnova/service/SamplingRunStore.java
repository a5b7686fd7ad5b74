package com.di.splitnova.service;

import java.util.List;
import java.util.Optional;

/**
 * History of sampling runs, newest first.
 */
public interface SamplingRunStore {

    /**
     * Saves a finished run.
     *
     * @return the run id that was stored
     */
    String save(SamplingRun run);

    Optional<SamplingRun> findByRunId(String runId);

    /** The most recent runs, newest first, at most {@code limit} of them. */
    List<SamplingRun> findRecent(int limit);
}
