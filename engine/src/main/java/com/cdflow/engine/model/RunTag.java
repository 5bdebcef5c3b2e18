package com.cdflow.engine.model;

import jakarta.persistence.*;
import java.util.Objects;

/**
 * A searchable key/value pair attached to a run (branch, commit, author...).
 *
 * The primary key spans all three columns, so a run can never hold the same
 * pair twice. Tags are always replaced as a whole set (see TagIndexer).
 *
 * DB table: workflow_run_tag  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_run_tag")
@IdClass(RunTagId.class)
public class RunTag {

    @Id
    @Column(name = "workflow_run_id", nullable = false)
    private Long workflowRunId;

    @Id
    @Column(name = "tag_key", nullable = false)
    private String tag;

    @Id
    @Column(name = "tag_value", nullable = false)
    private String value;

    protected RunTag() {}   // required by JPA

    public RunTag(Long workflowRunId, String tag, String value) {
        this.workflowRunId = workflowRunId;
        this.tag           = tag;
        this.value         = value;
    }

    /** A tag not yet bound to a stored run. */
    public static RunTag of(String tag, String value) {
        return new RunTag(null, tag, value);
    }

    public Long   getWorkflowRunId() { return workflowRunId; }
    public String getTag()           { return tag; }
    public String getValue()         { return value; }

    /** Same pair bound to the given run. */
    public RunTag forRun(long runId) {
        return new RunTag(runId, tag, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunTag other)) return false;
        return Objects.equals(workflowRunId, other.workflowRunId)
            && Objects.equals(tag, other.tag)
            && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowRunId, tag, value);
    }

    @Override
    public String toString() {
        return tag + "=" + value;
    }
}
