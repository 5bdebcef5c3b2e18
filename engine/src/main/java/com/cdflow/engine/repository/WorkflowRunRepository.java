package com.cdflow.engine.repository;

import com.cdflow.engine.model.WorkflowRun;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Queries for the workflow_run table.
 *
 * Project and workflow are addressed by their natural keys (project key,
 * workflow name), so the lookups join the project and workflow reference
 * tables with native SQL.
 */
public interface WorkflowRunRepository extends JpaRepository<WorkflowRun, Long> {

    @Query(value = """
            SELECT wr.* FROM workflow_run wr
            JOIN project p  ON wr.project_id = p.id
            JOIN workflow w ON wr.workflow_id = w.id
            WHERE p.projectkey = :projectKey
              AND w.name = :workflowName
            ORDER BY wr.run_number DESC
            LIMIT 1
            """, nativeQuery = true)
    Optional<WorkflowRun> findLast(@Param("projectKey") String projectKey,
                                   @Param("workflowName") String workflowName);

    @Query(value = """
            SELECT wr.* FROM workflow_run wr
            JOIN project p  ON wr.project_id = p.id
            JOIN workflow w ON wr.workflow_id = w.id
            WHERE p.projectkey = :projectKey
              AND w.name = :workflowName
              AND wr.run_number = :number
            """, nativeQuery = true)
    Optional<WorkflowRun> findByNumber(@Param("projectKey") String projectKey,
                                       @Param("workflowName") String workflowName,
                                       @Param("number") long number);

    @Query(value = """
            SELECT wr.* FROM workflow_run wr
            JOIN project p ON wr.project_id = p.id
            WHERE p.projectkey = :projectKey
              AND wr.id = :id
            """, nativeQuery = true)
    Optional<WorkflowRun> findByIdAndProjectKey(@Param("projectKey") String projectKey,
                                                @Param("id") long id);

    @Query(value = """
            SELECT count(wr.id) FROM workflow_run wr
            JOIN project p  ON wr.project_id = p.id
            JOIN workflow w ON wr.workflow_id = w.id
            WHERE p.projectkey = :projectKey
              AND w.name = :workflowName
            """, nativeQuery = true)
    long countRuns(@Param("projectKey") String projectKey,
                   @Param("workflowName") String workflowName);

    @Query(value = """
            SELECT wr.* FROM workflow_run wr
            JOIN project p  ON wr.project_id = p.id
            JOIN workflow w ON wr.workflow_id = w.id
            WHERE p.projectkey = :projectKey
              AND w.name = :workflowName
            ORDER BY wr.started_at DESC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<WorkflowRun> findPage(@Param("projectKey") String projectKey,
                               @Param("workflowName") String workflowName,
                               @Param("offset") int offset,
                               @Param("limit") int limit);

    /**
     * Load a run and lock its row without waiting.
     *
     * A lock timeout of 0 makes Hibernate emit FOR UPDATE NOWAIT: if another
     * transaction already holds the row, PostgreSQL fails at once with
     * lock_not_available (55P03) instead of queueing. Spring translates that
     * into a PessimisticLockingFailureException.
     *
     * Must run inside a @Transactional method; the lock is released when
     * that transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "0"))
    @Query("SELECT r FROM WorkflowRun r WHERE r.id = :id")
    Optional<WorkflowRun> findAndLockById(@Param("id") long id);

    /**
     * Atomically allocate the next run number of a workflow.
     * Backed by an upsert on workflow_sequence (see V1 migration).
     */
    @Query(value = "SELECT workflow_sequences_nextval(:workflowId)", nativeQuery = true)
    long nextRunNumber(@Param("workflowId") long workflowId);
}
