package com.cdflow.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One node of a workflow DAG: a pipeline to run once all parents succeeded.
 * A node without parents is a root and is scheduled when the run is created.
 */
public class WorkflowNode {

    private Long       id;
    private String     name;
    private String     pipelineName;
    private List<Long> parentIds = new ArrayList<>();

    public WorkflowNode() {}   // required by Jackson

    public WorkflowNode(Long id, String name, String pipelineName, List<Long> parentIds) {
        this.id           = id;
        this.name         = name;
        this.pipelineName = pipelineName;
        this.parentIds    = parentIds == null ? new ArrayList<>() : new ArrayList<>(parentIds);
    }

    public Long       getId()           { return id; }
    public String     getName()         { return name; }
    public String     getPipelineName() { return pipelineName; }
    public List<Long> getParentIds()    { return parentIds; }

    public void setId(Long id)                      { this.id = id; }
    public void setName(String name)                { this.name = name; }
    public void setPipelineName(String pipelineName) { this.pipelineName = pipelineName; }
    public void setParentIds(List<Long> parentIds)  { this.parentIds = parentIds == null ? new ArrayList<>() : parentIds; }

    @JsonIgnore
    public boolean isRoot() {
        return parentIds.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowNode other)) return false;
        return Objects.equals(id, other.id)
            && Objects.equals(name, other.name)
            && Objects.equals(pipelineName, other.pipelineName)
            && Objects.equals(parentIds, other.parentIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, pipelineName, parentIds);
    }
}
