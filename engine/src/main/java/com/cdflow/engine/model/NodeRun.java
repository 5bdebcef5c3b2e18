package com.cdflow.engine.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One execution attempt of one workflow node within a run.
 *
 * sub_number is 0 for the first attempt and grows by one with each retry
 * of the same node. Attempts are never deleted.
 *
 * DB table: workflow_node_run  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_node_run")
public class NodeRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_run_id", nullable = false)
    private long workflowRunId;

    @Column(name = "workflow_node_id", nullable = false)
    private long workflowNodeId;

    // Copy of the owning run's number, handy for executor-side logging.
    @Column(name = "run_number", nullable = false)
    private long number;

    @Column(name = "sub_number", nullable = false)
    private int subNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private NodeRunStatus status = NodeRunStatus.WAITING;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant start;

    @Column(name = "last_modified_at", nullable = false)
    private Instant lastModified;

    // Null until the attempt reaches a terminal status.
    @Column(name = "finished_at")
    private Instant done;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected NodeRun() {}   // required by JPA

    public NodeRun(long workflowNodeId, long number, int subNumber, Instant start) {
        this.workflowNodeId = workflowNodeId;
        this.number         = number;
        this.subNumber      = subNumber;
        this.start          = start;
        this.lastModified   = start;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long          getId()             { return id; }
    public long          getWorkflowRunId()  { return workflowRunId; }
    public long          getWorkflowNodeId() { return workflowNodeId; }
    public long          getNumber()         { return number; }
    public int           getSubNumber()      { return subNumber; }
    public NodeRunStatus getStatus()         { return status; }
    public Instant       getStart()          { return start; }
    public Instant       getLastModified()   { return lastModified; }
    public Instant       getDone()           { return done; }

    public void setWorkflowRunId(long workflowRunId)   { this.workflowRunId = workflowRunId; }
    public void setLastModified(Instant lastModified)  { this.lastModified = lastModified; }
    public void setDone(Instant done)                  { this.done = done; }

    /** Sets the status and stamps lastModified, plus done when the status is terminal. */
    public void transition(NodeRunStatus status, Instant at) {
        this.status       = status;
        this.lastModified = at;
        if (status.isTerminal()) {
            this.done = at;
        }
    }
}
