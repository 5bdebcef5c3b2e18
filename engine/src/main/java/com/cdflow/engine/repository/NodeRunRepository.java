package com.cdflow.engine.repository;

import com.cdflow.engine.model.NodeRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD + history query for the workflow_node_run table.
 */
public interface NodeRunRepository extends JpaRepository<NodeRun, Long> {

    /** Every attempt of every node of a run, latest attempts first. */
    List<NodeRun> findByWorkflowRunIdOrderBySubNumberDesc(long workflowRunId);
}
