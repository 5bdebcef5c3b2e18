package com.cdflow.engine.api.dto;

import com.cdflow.engine.model.NodeRun;
import com.cdflow.engine.model.NodeRunStatus;

import java.time.Instant;

/**
 * Read-only view of one node attempt.
 */
public record NodeRunResponse(
        Long          id,
        long          nodeId,
        int           subNumber,
        NodeRunStatus status,
        Instant       start,
        Instant       lastModified,
        Instant       done
) {
    public static NodeRunResponse from(NodeRun n) {
        return new NodeRunResponse(
                n.getId(),
                n.getWorkflowNodeId(),
                n.getSubNumber(),
                n.getStatus(),
                n.getStart(),
                n.getLastModified(),
                n.getDone()
        );
    }
}
