package com.cdflow.engine.model;

import java.io.Serializable;
import java.util.Objects;

/** Composite primary key of {@link RunTag}. */
public class RunTagId implements Serializable {

    private Long   workflowRunId;
    private String tag;
    private String value;

    public RunTagId() {}

    public RunTagId(Long workflowRunId, String tag, String value) {
        this.workflowRunId = workflowRunId;
        this.tag           = tag;
        this.value         = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunTagId other)) return false;
        return Objects.equals(workflowRunId, other.workflowRunId)
            && Objects.equals(tag, other.tag)
            && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowRunId, tag, value);
    }
}
