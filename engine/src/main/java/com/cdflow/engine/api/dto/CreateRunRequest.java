package com.cdflow.engine.api.dto;

import com.cdflow.engine.model.TriggerContext;
import com.cdflow.engine.model.Workflow;

/**
 * Request body for POST /projects/{key}/workflows/{name}/runs.
 *
 * Required: workflow (the definition as it stands at trigger time)
 * Optional: trigger — defaults to an anonymous manual trigger.
 */
public record CreateRunRequest(Workflow workflow, TriggerContext trigger) {

    public CreateRunRequest {
        if (trigger == null) trigger = TriggerContext.manual("anonymous");
    }
}
