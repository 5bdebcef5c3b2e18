package com.cdflow.engine.service;

import com.cdflow.engine.model.*;
import com.cdflow.engine.serializer.RunSerializer;
import com.cdflow.engine.store.LockConflictException;
import com.cdflow.engine.store.RunStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Business rules of the workflow run lifecycle.
 *
 * Every mutation follows the same pipeline inside one transaction:
 *   loadAndLockRun → change node runs / infos → recompute status
 *   → updateRun → replaceTags
 * and NodeReadyEvents are published once that transaction has committed.
 *
 * Run numbers are allocated by the store in a transaction of their own,
 * before the creating transaction is opened: a caller never holds one pooled
 * connection while waiting for a second.
 *
 * The run lock is taken with NOWAIT: a concurrent mutation of the same run
 * surfaces as LockConflictException and the caller decides how to retry.
 * Nothing here blocks waiting for another reporter.
 */
@Service
public class RunEngine {

    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);

    private final RunStore                  store;
    private final RunSerializer             serializer;
    private final TagIndexer                tagIndexer;
    private final ApplicationEventPublisher events;
    private final MeterRegistry             meterRegistry;
    private final TransactionTemplate       tx;

    /** Outcome of one committed mutation: the run and the attempts it scheduled. */
    private record Mutation(long runId, WorkflowRun run, List<NodeRun> scheduled) {}

    public RunEngine(RunStore store,
                     RunSerializer serializer,
                     TagIndexer tagIndexer,
                     ApplicationEventPublisher events,
                     MeterRegistry meterRegistry,
                     TransactionTemplate tx) {
        this.store         = store;
        this.serializer    = serializer;
        this.tagIndexer    = tagIndexer;
        this.events        = events;
        this.meterRegistry = meterRegistry;
        this.tx            = tx;
    }

    // ------------------------------------------------------------------
    // Run creation
    // ------------------------------------------------------------------

    /**
     * Create a run of a workflow.
     *
     * Steps:
     *  1. Validate the definition and the trigger context
     *  2. Allocate the run number, outside any open transaction
     *  3. Snapshot the definition (deep copy)
     *  4. Schedule every root node as a WAITING attempt 0
     *  5. Persist and index tags in one transaction
     *  6. After commit, signal the scheduled nodes
     */
    public WorkflowRun createRun(Workflow workflow, TriggerContext trigger) {
        validateDefinition(workflow);
        if (trigger == null) {
            throw new ValidationException("Missing trigger context for workflow " + workflow.getName());
        }

        long number = store.nextRunNumber(workflow.getId());
        Instant now = Instant.now();

        WorkflowRun run = new WorkflowRun(serializer.copy(workflow), number, now);
        run.setTags(tagIndexer.deriveTags(trigger));

        List<NodeRun> scheduled = new ArrayList<>();
        for (WorkflowNode root : run.getWorkflow().getRootNodes()) {
            scheduled.add(schedule(run, root, now));
        }
        run.setStatus(computeStatus(run));

        long runId = tx.execute(status -> {
            long id = store.insertRun(run);
            tagIndexer.replaceTags(id, run.getTags());
            return id;
        });
        publishReady(runId, run, scheduled);

        meterRegistry.counter("cdflow.run.created").increment();
        log.info("Workflow run {} created: {}/{} #{} ({} node(s) scheduled)",
                runId, workflow.getProjectKey(), workflow.getName(), number, scheduled.size());
        return run;
    }

    // ------------------------------------------------------------------
    // Node progress (called for every executor report)
    // ------------------------------------------------------------------

    /**
     * Record the progress of one node of a run.
     *
     * The latest attempt of the node is updated in place while it is still
     * WAITING or BUILDING; otherwise the report opens a new attempt with the
     * next sub-number. Reporting WAITING on a finished node is a re-trigger.
     * When the node succeeds, every child whose parents all succeeded is
     * scheduled; the new attempts are signalled after commit.
     *
     * @throws LockConflictException if another mutation holds the run (no wait)
     * @throws ValidationException   if the run is finished, the node unknown or the status missing
     */
    public WorkflowRun advanceNode(long runId, long nodeId, NodeRunStatus status, List<WorkflowRunInfo> infos) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String result = "success";
        try {
            if (status == null) {
                throw new ValidationException("Missing status for node " + nodeId + " of run " + runId);
            }

            Mutation done = tx.execute(txStatus -> applyProgress(runId, nodeId, status, infos));
            publishReady(done.runId(), done.run(), done.scheduled());
            return done.run();
        } catch (LockConflictException e) {
            result = "lock_conflict";
            throw e;
        } catch (ValidationException e) {
            result = "rejected";
            log.warn("Rejected progress of node {} on run {}: {}", nodeId, runId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            result = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("cdflow.run.advance.duration"));
            meterRegistry.counter("cdflow.run.advance", "result", result).increment();
        }
    }

    private Mutation applyProgress(long runId, long nodeId, NodeRunStatus status, List<WorkflowRunInfo> infos) {
        WorkflowRun run = store.loadAndLockRun(runId);
        requireRunning(runId, run);
        WorkflowNode node = run.getWorkflow().findNode(nodeId).orElseThrow(() ->
                new ValidationException("Node " + nodeId + " is not part of workflow run " + runId));

        Instant now = Instant.now();
        List<NodeRun> scheduled = new ArrayList<>();
        NodeRun latest = run.latestNodeRun(nodeId);

        if (status == NodeRunStatus.WAITING) {
            if (latest != null && !latest.getStatus().isTerminal()) {
                throw new ValidationException("Node " + nodeId + " of run " + runId + " is already "
                        + latest.getStatus());
            }
            scheduled.add(schedule(run, node, now));
        } else {
            NodeRun attempt = latest;
            if (attempt == null || attempt.getStatus().isTerminal()) {
                attempt = new NodeRun(nodeId, run.getNumber(), run.nextSubNumber(nodeId), now);
                run.addNodeRun(attempt);
            }
            attempt.transition(status, now);
            if (status == NodeRunStatus.SUCCESS) {
                scheduled.addAll(scheduleReadyChildren(run, node, now));
            }
        }

        if (infos != null) {
            run.getInfos().addAll(infos);
        }
        persist(runId, run);
        return new Mutation(runId, run, scheduled);
    }

    /**
     * Stop a running workflow: every unfinished latest attempt becomes STOPPED.
     *
     * @throws LockConflictException if another mutation holds the run (no wait)
     * @throws ValidationException   if the run is already finished
     */
    public WorkflowRun stopRun(long runId, String actor) {
        return tx.execute(status -> {
            WorkflowRun run = store.loadAndLockRun(runId);
            requireRunning(runId, run);

            Instant now = Instant.now();
            for (NodeRun attempt : run.latestNodeRuns()) {
                if (!attempt.getStatus().isTerminal()) {
                    attempt.transition(NodeRunStatus.STOPPED, now);
                }
            }
            run.getInfos().add(new WorkflowRunInfo(now, "Workflow run stopped by " + actor, false));
            persist(runId, run);
            return run;
        });
    }

    // ------------------------------------------------------------------
    // Status aggregation
    // ------------------------------------------------------------------

    /**
     * Status of a run from its infos and the latest attempt of each node.
     * Earlier attempts are history and do not count.
     *
     * Order matters: an error info wins over everything, then any unfinished
     * node keeps the run BUILDING, then FAIL beats STOPPED beats SUCCESS.
     */
    public static RunStatus computeStatus(WorkflowRun run) {
        if (run.getInfos().stream().anyMatch(WorkflowRunInfo::error)) {
            return RunStatus.FAIL;
        }
        List<NodeRun> latest = run.latestNodeRuns();
        if (latest.stream().anyMatch(n -> !n.getStatus().isTerminal())) {
            return RunStatus.BUILDING;
        }
        if (latest.stream().anyMatch(n -> n.getStatus() == NodeRunStatus.FAIL)) {
            return RunStatus.FAIL;
        }
        if (latest.stream().anyMatch(n -> n.getStatus() == NodeRunStatus.STOPPED)) {
            return RunStatus.STOPPED;
        }
        return RunStatus.SUCCESS;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void persist(long runId, WorkflowRun run) {
        RunStatus before = run.getStatus();
        run.setStatus(computeStatus(run));
        store.updateRun(run);
        tagIndexer.replaceTags(runId, run.getTags());

        if (run.getStatus() != before) {
            log.info("Workflow run {} #{}: {} → {}", runId, run.getNumber(), before, run.getStatus());
        }
    }

    private static void requireRunning(long runId, WorkflowRun run) {
        if (run.getStatus().isTerminal()) {
            throw new ValidationException("Workflow run " + runId + " is already "
                    + run.getStatus() + " and cannot be modified");
        }
    }

    private static NodeRun schedule(WorkflowRun run, WorkflowNode node, Instant now) {
        NodeRun attempt = new NodeRun(node.getId(), run.getNumber(), run.nextSubNumber(node.getId()), now);
        run.addNodeRun(attempt);
        return attempt;
    }

    /** Children of {@code parent} whose parents' latest attempts all succeeded. */
    private static List<NodeRun> scheduleReadyChildren(WorkflowRun run, WorkflowNode parent, Instant now) {
        List<NodeRun> scheduled = new ArrayList<>();
        for (WorkflowNode child : run.getWorkflow().childrenOf(parent.getId())) {
            boolean parentsDone = child.getParentIds().stream().allMatch(pid -> {
                NodeRun p = run.latestNodeRun(pid);
                return p != null && p.getStatus() == NodeRunStatus.SUCCESS;
            });
            NodeRun current = run.latestNodeRun(child.getId());
            boolean alreadyPending = current != null && !current.getStatus().isTerminal();
            if (parentsDone && !alreadyPending) {
                scheduled.add(schedule(run, child, now));
            }
        }
        return scheduled;
    }

    private void publishReady(long runId, WorkflowRun run, List<NodeRun> scheduled) {
        for (NodeRun attempt : scheduled) {
            String pipeline = run.getWorkflow().findNode(attempt.getWorkflowNodeId())
                    .map(WorkflowNode::getPipelineName)
                    .orElse(null);
            events.publishEvent(new NodeReadyEvent(runId, run.getNumber(),
                    attempt.getWorkflowNodeId(), attempt.getSubNumber(), pipeline));
        }
    }

    /**
     * A definition is usable when it is identified, has at least one node,
     * every parent reference resolves and the graph has no cycle.
     */
    static void validateDefinition(Workflow workflow) {
        if (workflow == null) {
            throw new ValidationException("Missing workflow definition");
        }
        if (workflow.getId() == null || workflow.getProjectId() == null
                || workflow.getName() == null || workflow.getName().isBlank()) {
            throw new ValidationException("Workflow definition must have an id, a project id and a name");
        }
        if (workflow.getNodes().isEmpty()) {
            throw new ValidationException("Workflow " + workflow.getName() + " has no node");
        }

        Map<Long, Integer> pendingParents = new HashMap<>();
        for (WorkflowNode node : workflow.getNodes()) {
            int distinctParents = new HashSet<>(node.getParentIds()).size();
            if (node.getId() == null || pendingParents.put(node.getId(), distinctParents) != null) {
                throw new ValidationException("Workflow " + workflow.getName() + " has a missing or duplicate node id");
            }
        }
        for (WorkflowNode node : workflow.getNodes()) {
            for (Long parentId : node.getParentIds()) {
                if (!pendingParents.containsKey(parentId)) {
                    throw new ValidationException("Node " + node.getId() + " of workflow " + workflow.getName()
                            + " references unknown parent " + parentId);
                }
            }
        }

        // Kahn: every node must be reachable by peeling off nodes whose parents are all visited.
        Deque<Long> ready = new ArrayDeque<>();
        pendingParents.forEach((id, count) -> {
            if (count == 0) ready.add(id);
        });
        Set<Long> visited = new HashSet<>();
        while (!ready.isEmpty()) {
            long id = ready.poll();
            visited.add(id);
            for (WorkflowNode child : workflow.childrenOf(id)) {
                int remaining = pendingParents.merge(child.getId(), -1, Integer::sum);
                if (remaining == 0) ready.add(child.getId());
            }
        }
        if (visited.size() != workflow.getNodes().size()) {
            throw new ValidationException("Workflow " + workflow.getName() + " is not acyclic");
        }
    }
}
