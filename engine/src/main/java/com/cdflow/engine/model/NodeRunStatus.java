package com.cdflow.engine.model;

/**
 * Status of one attempt of one workflow node.
 *
 * Transitions:
 *   WAITING  → BUILDING (picked up by an executor)
 *   BUILDING → SUCCESS | FAIL
 *   WAITING | BUILDING → STOPPED (run stopped)
 *
 * A terminal attempt is never mutated again; a retry appends a new attempt.
 */
public enum NodeRunStatus {
    WAITING,
    BUILDING,
    SUCCESS,
    FAIL,
    STOPPED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAIL || this == STOPPED;
    }
}
