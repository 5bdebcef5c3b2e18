package com.cdflow.engine.repository;

import com.cdflow.engine.model.RunTag;
import com.cdflow.engine.model.RunTagId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * CRUD + aggregation queries for the workflow_run_tag table.
 */
public interface RunTagRepository extends JpaRepository<RunTag, RunTagId> {

    List<RunTag> findByWorkflowRunId(long workflowRunId);

    /**
     * Bulk delete of every tag of a run.
     *
     * Flushes pending writes first and clears the persistence context after,
     * so tags re-inserted in the same transaction are not mistaken for the
     * stale managed instances that this statement just removed.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RunTag t WHERE t.workflowRunId = :runId")
    int deleteByRunId(@Param("runId") long runId);

    /**
     * Distinct (tag_key, tag_value) pairs over every run of a workflow.
     * Each row is {@code Object[]{tagKey, tagValue}}.
     */
    @Query(value = """
            SELECT DISTINCT t.tag_key, t.tag_value
            FROM workflow_run_tag t
            JOIN workflow_run wr ON t.workflow_run_id = wr.id
            JOIN workflow w      ON wr.workflow_id = w.id
            JOIN project p       ON w.project_id = p.id
            WHERE p.projectkey = :projectKey
              AND w.name = :workflowName
            """, nativeQuery = true)
    List<Object[]> findDistinctTagValues(@Param("projectKey") String projectKey,
                                         @Param("workflowName") String workflowName);
}
