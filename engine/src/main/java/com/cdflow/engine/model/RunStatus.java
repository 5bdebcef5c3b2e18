package com.cdflow.engine.model;

/**
 * Aggregate status of a WorkflowRun.
 *
 * Transitions:
 *   BUILDING → SUCCESS | FAIL | STOPPED
 *
 * All three outcomes are terminal: a finished run is never reopened.
 */
public enum RunStatus {
    BUILDING,
    SUCCESS,
    FAIL,
    STOPPED;

    public boolean isTerminal() {
        return this != BUILDING;
    }
}
