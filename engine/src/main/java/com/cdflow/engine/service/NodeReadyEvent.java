package com.cdflow.engine.service;

/**
 * Signal that a node attempt has been scheduled and can be handed to an executor.
 *
 * Published through Spring's ApplicationEventPublisher after the transaction
 * that wrote the new attempt has committed and released the run lock, so a
 * plain @EventListener can load the run straight away. Worker dispatch
 * listens for it; the engine itself never talks to workers.
 */
public record NodeReadyEvent(
        long   workflowRunId,
        long   runNumber,
        long   nodeId,
        int    subNumber,
        String pipelineName
) {}
