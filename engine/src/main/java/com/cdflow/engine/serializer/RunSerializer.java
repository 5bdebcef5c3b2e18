package com.cdflow.engine.serializer;

import com.cdflow.engine.model.Workflow;
import com.cdflow.engine.model.WorkflowRunInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for the two opaque columns of workflow_run.
 *
 * Rows written before a column existed hold NULL (or an empty string):
 * those decode to an empty value instead of failing. Anything else that
 * does not parse is a SerializationException.
 *
 * Uses a private copy of the application ObjectMapper so snapshot settings
 * (ISO timestamps, lenient on unknown properties) do not leak into the
 * REST layer.
 */
@Component
public class RunSerializer {

    private static final TypeReference<List<WorkflowRunInfo>> INFO_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public RunSerializer(ObjectMapper objectMapper) {
        this.json = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ------------------------------------------------------------------
    // Workflow snapshot
    // ------------------------------------------------------------------

    public String encodeSnapshot(Workflow workflow) {
        try {
            return json.writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Unable to encode workflow snapshot " + describe(workflow), e);
        }
    }

    public Workflow decodeSnapshot(String blob) {
        if (blob == null || blob.isBlank()) {
            return new Workflow();
        }
        try {
            Workflow workflow = json.readValue(blob, Workflow.class);
            return workflow == null ? new Workflow() : workflow;
        } catch (JsonProcessingException e) {
            throw new SerializationException("Unable to decode workflow snapshot", e);
        }
    }

    /** Deep, independent copy of a definition, taken through its JSON form. */
    public Workflow copy(Workflow workflow) {
        return decodeSnapshot(encodeSnapshot(workflow));
    }

    // ------------------------------------------------------------------
    // Info log
    // ------------------------------------------------------------------

    public String encodeInfos(List<WorkflowRunInfo> infos) {
        try {
            return json.writeValueAsString(infos == null ? List.of() : infos);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Unable to encode run infos", e);
        }
    }

    public List<WorkflowRunInfo> decodeInfos(String blob) {
        if (blob == null || blob.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<WorkflowRunInfo> infos = json.readValue(blob, INFO_LIST_TYPE);
            return infos == null ? new ArrayList<>() : new ArrayList<>(infos);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Unable to decode run infos", e);
        }
    }

    private static String describe(Workflow workflow) {
        return workflow == null ? "<null>" : workflow.getProjectKey() + "/" + workflow.getName();
    }
}
