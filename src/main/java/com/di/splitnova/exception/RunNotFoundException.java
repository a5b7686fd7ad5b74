package com.di.splitnova.exception;

/**
 * Thrown when a run id is not present in the run history.
 */
public class RunNotFoundException extends RuntimeException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("No sampling run with id: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
