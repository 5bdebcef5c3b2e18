package com.cdflow.engine.model;

import java.time.Instant;

/**
 * One entry of a run's info log.
 * An entry with error = true forces the run to FAIL.
 */
public record WorkflowRunInfo(Instant apiTime, String message, boolean error) {

    public static WorkflowRunInfo info(String message) {
        return new WorkflowRunInfo(Instant.now(), message, false);
    }

    public static WorkflowRunInfo error(String message) {
        return new WorkflowRunInfo(Instant.now(), message, true);
    }
}
