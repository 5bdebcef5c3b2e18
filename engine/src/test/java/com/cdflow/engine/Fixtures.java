package com.cdflow.engine;

import com.cdflow.engine.model.NodeRun;
import com.cdflow.engine.model.NodeRunStatus;
import com.cdflow.engine.model.Workflow;
import com.cdflow.engine.model.WorkflowNode;
import com.cdflow.engine.model.WorkflowRun;

import java.time.Instant;
import java.util.List;

/**
 * Shared test object factories.
 */
public final class Fixtures {

    private Fixtures() {}

    /** build (10) → deploy (20), in project PROJ. */
    public static Workflow helloPipeline() {
        return new Workflow(1L, 2L, "PROJ", "HelloPipeline", List.of(
                new WorkflowNode(10L, "build", "build", List.of()),
                new WorkflowNode(20L, "deploy", "deploy", List.of(10L))));
    }

    /** Three independent root nodes: 10, 11, 12. */
    public static Workflow parallelPipeline() {
        return new Workflow(3L, 2L, "PROJ", "ParallelPipeline", List.of(
                new WorkflowNode(10L, "unit", "unit-tests", List.of()),
                new WorkflowNode(11L, "lint", "lint", List.of()),
                new WorkflowNode(12L, "docs", "docs", List.of())));
    }

    /** a (10), b (11) → c (20): c needs both parents. */
    public static Workflow diamondPipeline() {
        return new Workflow(4L, 2L, "PROJ", "DiamondPipeline", List.of(
                new WorkflowNode(10L, "a", "a", List.of()),
                new WorkflowNode(11L, "b", "b", List.of()),
                new WorkflowNode(20L, "c", "c", List.of(10L, 11L))));
    }

    public static WorkflowRun run(Workflow workflow, long number) {
        return new WorkflowRun(workflow, number, Instant.now());
    }

    /** Appends an attempt in the given status and returns it. */
    public static NodeRun attempt(WorkflowRun run, long nodeId, NodeRunStatus status) {
        NodeRun attempt = new NodeRun(nodeId, run.getNumber(), run.nextSubNumber(nodeId), Instant.now());
        attempt.transition(status, Instant.now());
        run.addNodeRun(attempt);
        return attempt;
    }

    /** Sets the id normally assigned by the database on persist. */
    public static <T> T withId(T entity, long id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }
}
