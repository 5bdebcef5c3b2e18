package com.cdflow.engine.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One triggered execution of a Workflow.
 *
 * Persisted twice over, in the same transaction:
 *   - structured columns (number, status, timestamps) for filtering and ordering
 *   - JSON text columns (workflow_snapshot, infos) for full-fidelity restoration
 *
 * The JSON columns are written and read by RunStore through RunSerializer;
 * the decoded values live in the transient fields below. Node runs and tags
 * are stored in their own tables and attached by RunStore on load.
 *
 * DB table: workflow_run  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_run")
public class WorkflowRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private long projectId;

    @Column(name = "workflow_id", nullable = false)
    private long workflowId;

    // Unique per workflow, allocated by workflow_sequences_nextval().
    @Column(name = "run_number", nullable = false)
    private long number;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.BUILDING;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant start;

    @Column(name = "last_modified_at", nullable = false)
    private Instant lastModified;

    @Column(name = "workflow_snapshot", columnDefinition = "TEXT")
    private String workflowJson;

    @Column(name = "infos", columnDefinition = "TEXT")
    private String infosJson;

    @Transient
    private Workflow workflow = new Workflow();

    @Transient
    private List<WorkflowRunInfo> infos = new ArrayList<>();

    // nodeId → attempts, latest (highest sub-number) first.
    @Transient
    private Map<Long, List<NodeRun>> nodeRuns = new LinkedHashMap<>();

    @Transient
    private List<RunTag> tags = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowRun() {}   // required by JPA

    public WorkflowRun(Workflow snapshot, long number, Instant start) {
        this.workflow     = snapshot;
        this.projectId    = snapshot.getProjectId();
        this.workflowId   = snapshot.getId();
        this.number       = number;
        this.start        = start;
        this.lastModified = start;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long                       getId()           { return id; }
    public long                       getProjectId()    { return projectId; }
    public long                       getWorkflowId()   { return workflowId; }
    public long                       getNumber()       { return number; }
    public RunStatus                  getStatus()       { return status; }
    public Instant                    getStart()        { return start; }
    public Instant                    getLastModified() { return lastModified; }
    public String                     getWorkflowJson() { return workflowJson; }
    public String                     getInfosJson()    { return infosJson; }
    public Workflow                   getWorkflow()     { return workflow; }
    public List<WorkflowRunInfo>      getInfos()        { return infos; }
    public Map<Long, List<NodeRun>>   getNodeRuns()     { return nodeRuns; }
    public List<RunTag>               getTags()         { return tags; }

    public void setStatus(RunStatus status)            { this.status = status; }
    public void setLastModified(Instant lastModified)  { this.lastModified = lastModified; }
    public void setWorkflowJson(String workflowJson)   { this.workflowJson = workflowJson; }
    public void setInfosJson(String infosJson)         { this.infosJson = infosJson; }
    public void setWorkflow(Workflow workflow)         { this.workflow = workflow; }
    public void setInfos(List<WorkflowRunInfo> infos)  { this.infos = new ArrayList<>(infos); }
    public void setNodeRuns(Map<Long, List<NodeRun>> nodeRuns) { this.nodeRuns = nodeRuns; }
    public void setTags(List<RunTag> tags)             { this.tags = new ArrayList<>(tags); }

    // ------------------------------------------------------------------
    // Node-run history
    // ------------------------------------------------------------------

    /** Latest attempt for a node, or null if the node was never scheduled. */
    public NodeRun latestNodeRun(long nodeId) {
        List<NodeRun> attempts = nodeRuns.get(nodeId);
        return attempts == null || attempts.isEmpty() ? null : attempts.get(0);
    }

    /** Next sub-number for a node: max(existing) + 1, or 0 for the first attempt. */
    public int nextSubNumber(long nodeId) {
        return nodeRuns.getOrDefault(nodeId, List.of()).stream()
                .mapToInt(NodeRun::getSubNumber)
                .max()
                .orElse(-1) + 1;
    }

    /** Prepends a new attempt so the history stays in descending sub-number order. */
    public void addNodeRun(NodeRun nodeRun) {
        nodeRuns.computeIfAbsent(nodeRun.getWorkflowNodeId(), k -> new ArrayList<>()).add(0, nodeRun);
    }

    public List<NodeRun> latestNodeRuns() {
        return nodeRuns.values().stream()
                .filter(attempts -> !attempts.isEmpty())
                .map(attempts -> attempts.get(0))
                .toList();
    }

    public List<NodeRun> allNodeRuns() {
        return nodeRuns.values().stream().flatMap(List::stream).toList();
    }
}
