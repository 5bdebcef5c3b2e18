package com.cdflow.engine.store;

import com.cdflow.engine.model.WorkflowRun;

/**
 * Durable storage of workflow runs, their node-run history and their tags.
 *
 * Every load returns a fully assembled run: decoded snapshot and infos,
 * node runs grouped per node in descending sub-number order, and tags.
 * Loads take no lock and only see committed data.
 *
 * Writes go through {@link #loadAndLockRun} followed by {@link #updateRun},
 * inside one transaction owned by the caller.
 */
public interface RunStore {

    /**
     * Insert a new run with its scheduled node runs and return its id.
     *
     * @throws com.cdflow.engine.serializer.SerializationException if the snapshot or infos cannot be encoded
     */
    long insertRun(WorkflowRun run);

    /** Overwrite structured fields and JSON columns, save node runs, stamp lastModified. */
    void updateRun(WorkflowRun run);

    /** @throws RunNotFoundException if the workflow has no such run */
    WorkflowRun loadRun(String projectKey, String workflowName, long number);

    /** @throws RunNotFoundException if the workflow has never run */
    WorkflowRun loadLastRun(String projectKey, String workflowName);

    /** @throws RunNotFoundException if no run has this id */
    WorkflowRun loadRunById(long id);

    /** @throws RunNotFoundException if no run of the project has this id */
    WorkflowRun loadRunByIdAndProjectKey(String projectKey, long id);

    /** Runs of a workflow ordered by start time, newest first. */
    RunPage loadRuns(String projectKey, String workflowName, int offset, int limit);

    /**
     * Load a run and take its exclusive mutation lock without waiting.
     *
     * @throws LockConflictException immediately if another mutation holds the lock
     * @throws RunNotFoundException  if no run has this id
     */
    WorkflowRun loadAndLockRun(long id);

    /**
     * Allocate the next run number of a workflow. Never returns the same
     * value twice for one workflow; gaps are possible.
     */
    long nextRunNumber(long workflowId);
}
