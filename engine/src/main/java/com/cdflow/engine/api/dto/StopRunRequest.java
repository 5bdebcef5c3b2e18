package com.cdflow.engine.api.dto;

/** Request body for POST /runs/{id}/stop. */
public record StopRunRequest(String actor) {

    public StopRunRequest {
        if (actor == null || actor.isBlank()) actor = "anonymous";
    }
}
