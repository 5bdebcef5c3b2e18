package com.cdflow.engine.store;

import com.cdflow.engine.model.WorkflowRun;

import java.util.List;

/**
 * One page of a workflow's run history, newest first.
 * {@code total} counts every run of the workflow, not just this page.
 */
public record RunPage(List<WorkflowRun> runs, int offset, int limit, long total) {

    public static RunPage empty() {
        return new RunPage(List.of(), 0, 0, 0);
    }
}
