package com.cdflow.engine.api.dto;

import com.cdflow.engine.model.RunStatus;
import com.cdflow.engine.model.RunTag;
import com.cdflow.engine.model.Workflow;
import com.cdflow.engine.model.WorkflowRun;
import com.cdflow.engine.model.WorkflowRunInfo;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response body for every run endpoint.
 *
 * nodeRuns maps a node id to its attempts, latest first. It is empty for
 * runs returned by the paginated listing.
 */
public record RunResponse(
        Long                               id,
        long                               number,
        RunStatus                          status,
        Instant                            start,
        Instant                            lastModified,
        Workflow                           workflow,
        Map<Long, List<NodeRunResponse>>   nodeRuns,
        Map<String, String>                tags,
        List<WorkflowRunInfo>              infos
) {
    public static RunResponse from(WorkflowRun run) {
        Map<Long, List<NodeRunResponse>> nodeRuns = new LinkedHashMap<>();
        run.getNodeRuns().forEach((nodeId, attempts) ->
                nodeRuns.put(nodeId, attempts.stream().map(NodeRunResponse::from).toList()));

        // A run may carry several values for one key; keep them comma-joined.
        Map<String, String> tags = new LinkedHashMap<>();
        for (RunTag t : run.getTags()) {
            tags.merge(t.getTag(), t.getValue(), (a, b) -> a + "," + b);
        }

        return new RunResponse(
                run.getId(),
                run.getNumber(),
                run.getStatus(),
                run.getStart(),
                run.getLastModified(),
                run.getWorkflow(),
                nodeRuns,
                tags,
                List.copyOf(run.getInfos())
        );
    }
}
