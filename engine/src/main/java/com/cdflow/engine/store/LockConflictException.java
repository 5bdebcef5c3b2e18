package com.cdflow.engine.store;

/**
 * Thrown when a run is already being mutated by another transaction.
 *
 * Expected under concurrent reporting and always recoverable: the caller
 * retries with its own backoff. The engine never waits for the lock.
 */
public class LockConflictException extends RuntimeException {

    private final long runId;

    public LockConflictException(long runId, Throwable cause) {
        super("Workflow run " + runId + " is locked by another mutation", cause);
        this.runId = runId;
    }

    public long getRunId() { return runId; }
}
