package com.cdflow.engine.api.dto;

import com.cdflow.engine.model.NodeRunStatus;
import com.cdflow.engine.model.WorkflowRunInfo;

import java.util.List;

/**
 * Request body for POST /runs/{id}/nodes/{nodeId}, sent by executors.
 */
public record AdvanceNodeRequest(NodeRunStatus status, List<WorkflowRunInfo> infos) {

    public AdvanceNodeRequest {
        if (infos == null) infos = List.of();
    }
}
