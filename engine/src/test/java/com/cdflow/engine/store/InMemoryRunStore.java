package com.cdflow.engine.store;

import com.cdflow.engine.Fixtures;
import com.cdflow.engine.model.NodeRun;
import com.cdflow.engine.model.RunStatus;
import com.cdflow.engine.model.RunTag;
import com.cdflow.engine.model.Workflow;
import com.cdflow.engine.model.WorkflowRun;
import com.cdflow.engine.serializer.RunSerializer;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RunStore double for engine tests that need real storage semantics without
 * a database: committed rows are copies, every load returns a fresh object
 * graph, and the run lock behaves like FOR UPDATE NOWAIT.
 *
 * Locks belong to the calling thread and are released by
 * {@link #endTransaction()}. {@link #transactionManager()} calls it on commit
 * and rollback, and records run numbers allocated while a transaction of the
 * calling thread was open.
 */
public class InMemoryRunStore implements RunStore {

    private record Row(long id, WorkflowRun run) {}

    private final RunSerializer                serializer;
    private final Map<Long, AtomicLong>        sequences = new ConcurrentHashMap<>();
    private final AtomicLong                   ids       = new AtomicLong();
    private final Map<Long, Row>               rows      = new ConcurrentHashMap<>();
    private final Map<Long, Thread>            locks     = new ConcurrentHashMap<>();
    private final ThreadLocal<Boolean>         inTx      = ThreadLocal.withInitial(() -> false);
    private final AtomicLong                   numbersInsideTx = new AtomicLong();

    public InMemoryRunStore(RunSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public long insertRun(WorkflowRun run) {
        long id = ids.incrementAndGet();
        rows.put(id, new Row(id, copy(run, id)));
        return id;
    }

    @Override
    public void updateRun(WorkflowRun run) {
        long id = run.getId();
        if (!rows.containsKey(id)) {
            throw new RunNotFoundException("Workflow run not found: id=" + id);
        }
        run.setLastModified(Instant.now());
        rows.put(id, new Row(id, copy(run, id)));
    }

    @Override
    public WorkflowRun loadRun(String projectKey, String workflowName, long number) {
        return rows.values().stream()
                .filter(r -> matches(r, projectKey, workflowName) && r.run().getNumber() == number)
                .findFirst()
                .map(r -> copy(r.run(), r.id()))
                .orElseThrow(() -> new RunNotFoundException(
                        "Workflow run not found: " + projectKey + "/" + workflowName + " #" + number));
    }

    @Override
    public WorkflowRun loadLastRun(String projectKey, String workflowName) {
        return rows.values().stream()
                .filter(r -> matches(r, projectKey, workflowName))
                .max(Comparator.comparingLong(r -> r.run().getNumber()))
                .map(r -> copy(r.run(), r.id()))
                .orElseThrow(() -> new RunNotFoundException(
                        "Workflow run not found: " + projectKey + "/" + workflowName + " (last)"));
    }

    @Override
    public WorkflowRun loadRunById(long id) {
        Row row = rows.get(id);
        if (row == null) {
            throw new RunNotFoundException("Workflow run not found: id=" + id);
        }
        return copy(row.run(), id);
    }

    @Override
    public WorkflowRun loadRunByIdAndProjectKey(String projectKey, long id) {
        Row row = rows.get(id);
        if (row == null || !projectKey.equals(row.run().getWorkflow().getProjectKey())) {
            throw new RunNotFoundException("Workflow run not found: " + projectKey + " id=" + id);
        }
        return copy(row.run(), id);
    }

    @Override
    public RunPage loadRuns(String projectKey, String workflowName, int offset, int limit) {
        List<Row> matching = rows.values().stream()
                .filter(r -> matches(r, projectKey, workflowName))
                .sorted(Comparator.comparing((Row r) -> r.run().getStart()).reversed())
                .toList();
        if (matching.isEmpty()) {
            return RunPage.empty();
        }
        List<WorkflowRun> page = matching.stream()
                .skip(offset)
                .limit(limit)
                .map(r -> copy(r.run(), r.id()))
                .toList();
        return new RunPage(page, offset, limit, matching.size());
    }

    @Override
    public WorkflowRun loadAndLockRun(long id) {
        Thread current = Thread.currentThread();
        Thread owner = locks.putIfAbsent(id, current);
        if (owner != null && owner != current) {
            throw new LockConflictException(id, null);
        }
        try {
            return loadRunById(id);
        } catch (RunNotFoundException e) {
            locks.remove(id, current);
            throw e;
        }
    }

    @Override
    public long nextRunNumber(long workflowId) {
        if (inTx.get()) {
            numbersInsideTx.incrementAndGet();
        }
        return sequences.computeIfAbsent(workflowId, k -> new AtomicLong()).incrementAndGet();
    }

    /** Releases every run lock held by the calling thread. */
    public void endTransaction() {
        Thread current = Thread.currentThread();
        locks.entrySet().removeIf(e -> e.getValue() == current);
        inTx.set(false);
    }

    /** Transaction manager whose commit and rollback release the caller's run locks. */
    public PlatformTransactionManager transactionManager() {
        return new PlatformTransactionManager() {
            @Override
            public TransactionStatus getTransaction(TransactionDefinition definition) {
                inTx.set(true);
                return new SimpleTransactionStatus();
            }

            @Override
            public void commit(TransactionStatus status) {
                endTransaction();
            }

            @Override
            public void rollback(TransactionStatus status) {
                endTransaction();
            }
        };
    }

    /** Run numbers allocated while the allocating thread had a transaction open. */
    public long numbersAllocatedInsideTransaction() {
        return numbersInsideTx.get();
    }

    public boolean isLocked(long id) {
        return locks.containsKey(id);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean matches(Row row, String projectKey, String workflowName) {
        Workflow w = row.run().getWorkflow();
        return projectKey.equals(w.getProjectKey()) && workflowName.equals(w.getName());
    }

    /** Deep copy through the same JSON encoding the real store uses. */
    private WorkflowRun copy(WorkflowRun source, long id) {
        WorkflowRun copy = new WorkflowRun(
                serializer.decodeSnapshot(serializer.encodeSnapshot(source.getWorkflow())),
                source.getNumber(),
                source.getStart());
        Fixtures.withId(copy, id);
        copy.setStatus(source.getStatus() == null ? RunStatus.BUILDING : source.getStatus());
        copy.setLastModified(source.getLastModified());
        copy.setInfos(serializer.decodeInfos(serializer.encodeInfos(source.getInfos())));

        Map<Long, List<NodeRun>> nodeRuns = new LinkedHashMap<>();
        source.getNodeRuns().forEach((nodeId, attempts) -> {
            List<NodeRun> copies = new ArrayList<>();
            for (NodeRun a : attempts) {
                NodeRun c = new NodeRun(a.getWorkflowNodeId(), a.getNumber(), a.getSubNumber(), a.getStart());
                c.transition(a.getStatus(), a.getLastModified());
                c.setDone(a.getDone());
                c.setWorkflowRunId(id);
                copies.add(c);
            }
            nodeRuns.put(nodeId, copies);
        });
        copy.setNodeRuns(nodeRuns);

        List<RunTag> tags = new ArrayList<>();
        source.getTags().forEach(t -> tags.add(RunTag.of(t.getTag(), t.getValue())));
        copy.setTags(tags);
        return copy;
    }
}
