package com.cdflow.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A workflow definition: a named DAG of pipeline nodes inside a project.
 *
 * Definitions are owned and edited elsewhere. A run keeps its own deep copy
 * (the snapshot), stored as JSON in workflow_run.workflow_snapshot, so later
 * edits never change what a past run executed.
 */
public class Workflow {

    private Long               id;
    private Long               projectId;
    private String             projectKey;
    private String             name;
    private Instant            lastModified;
    private List<WorkflowNode> nodes = new ArrayList<>();

    public Workflow() {}   // required by Jackson

    public Workflow(Long id, Long projectId, String projectKey, String name, List<WorkflowNode> nodes) {
        this.id         = id;
        this.projectId  = projectId;
        this.projectKey = projectKey;
        this.name       = name;
        this.nodes      = nodes == null ? new ArrayList<>() : new ArrayList<>(nodes);
    }

    public Long               getId()           { return id; }
    public Long               getProjectId()    { return projectId; }
    public String             getProjectKey()   { return projectKey; }
    public String             getName()         { return name; }
    public Instant            getLastModified() { return lastModified; }
    public List<WorkflowNode> getNodes()        { return nodes; }

    public void setId(Long id)                       { this.id = id; }
    public void setProjectId(Long projectId)         { this.projectId = projectId; }
    public void setProjectKey(String projectKey)     { this.projectKey = projectKey; }
    public void setName(String name)                 { this.name = name; }
    public void setLastModified(Instant lastModified) { this.lastModified = lastModified; }
    public void setNodes(List<WorkflowNode> nodes)   { this.nodes = nodes == null ? new ArrayList<>() : nodes; }

    // ------------------------------------------------------------------
    // DAG navigation
    // ------------------------------------------------------------------

    public Optional<WorkflowNode> findNode(long nodeId) {
        return nodes.stream()
                .filter(n -> n.getId() != null && n.getId() == nodeId)
                .findFirst();
    }

    @JsonIgnore
    public List<WorkflowNode> getRootNodes() {
        return nodes.stream().filter(WorkflowNode::isRoot).toList();
    }

    /** Nodes that list {@code nodeId} among their parents. */
    public List<WorkflowNode> childrenOf(long nodeId) {
        return nodes.stream()
                .filter(n -> n.getParentIds().contains(nodeId))
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Workflow other)) return false;
        return Objects.equals(id, other.id)
            && Objects.equals(projectId, other.projectId)
            && Objects.equals(projectKey, other.projectKey)
            && Objects.equals(name, other.name)
            && Objects.equals(lastModified, other.lastModified)
            && Objects.equals(nodes, other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, projectId, projectKey, name, lastModified, nodes);
    }
}
