package com.cdflow.engine.store;

import com.cdflow.engine.model.NodeRun;
import com.cdflow.engine.model.WorkflowRun;
import com.cdflow.engine.repository.NodeRunRepository;
import com.cdflow.engine.repository.RunTagRepository;
import com.cdflow.engine.repository.WorkflowRunRepository;
import com.cdflow.engine.serializer.RunSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * RunStore over PostgreSQL through Spring Data JPA.
 *
 * The JSON columns are handled explicitly here rather than with entity
 * lifecycle callbacks: encode right before every save, decode right after
 * every load. Structured columns and JSON columns of a run are therefore
 * always written in the same transaction.
 */
@Component
public class JpaRunStore implements RunStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRunStore.class);

    private final WorkflowRunRepository runRepo;
    private final NodeRunRepository     nodeRunRepo;
    private final RunTagRepository      tagRepo;
    private final RunSerializer         serializer;

    public JpaRunStore(WorkflowRunRepository runRepo,
                       NodeRunRepository nodeRunRepo,
                       RunTagRepository tagRepo,
                       RunSerializer serializer) {
        this.runRepo     = runRepo;
        this.nodeRunRepo = nodeRunRepo;
        this.tagRepo     = tagRepo;
        this.serializer  = serializer;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public long insertRun(WorkflowRun run) {
        encode(run);
        WorkflowRun saved = storage("insertRun", "workflow=" + run.getWorkflowId() + " number=" + run.getNumber(),
                () -> runRepo.save(run));
        saveNodeRuns(saved.getId(), run);
        log.debug("Inserted workflow run {} (workflow={}, number={})",
                saved.getId(), run.getWorkflowId(), run.getNumber());
        return saved.getId();
    }

    @Override
    @Transactional
    public void updateRun(WorkflowRun run) {
        run.setLastModified(Instant.now());
        encode(run);
        storage("updateRun", "id=" + run.getId(), () -> runRepo.save(run));
        saveNodeRuns(run.getId(), run);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public WorkflowRun loadRun(String projectKey, String workflowName, long number) {
        String key = projectKey + "/" + workflowName + " #" + number;
        return assemble(storage("loadRun", key, () -> runRepo.findByNumber(projectKey, workflowName, number)), key);
    }

    @Override
    @Transactional(readOnly = true)
    public WorkflowRun loadLastRun(String projectKey, String workflowName) {
        String key = projectKey + "/" + workflowName + " (last)";
        return assemble(storage("loadLastRun", key, () -> runRepo.findLast(projectKey, workflowName)), key);
    }

    @Override
    @Transactional(readOnly = true)
    public WorkflowRun loadRunById(long id) {
        String key = "id=" + id;
        return assemble(storage("loadRunById", key, () -> runRepo.findById(id)), key);
    }

    @Override
    @Transactional(readOnly = true)
    public WorkflowRun loadRunByIdAndProjectKey(String projectKey, long id) {
        String key = projectKey + " id=" + id;
        return assemble(storage("loadRunByIdAndProjectKey", key,
                () -> runRepo.findByIdAndProjectKey(projectKey, id)), key);
    }

    /**
     * Page of runs, newest first. The count runs first; when it is zero the
     * page query is skipped entirely.
     *
     * Listed runs carry their decoded snapshot, infos and tags, but not their
     * node-run history: use one of the single-run loads for that.
     */
    @Override
    @Transactional(readOnly = true)
    public RunPage loadRuns(String projectKey, String workflowName, int offset, int limit) {
        String key = projectKey + "/" + workflowName;
        long count = storage("loadRuns", key, () -> runRepo.countRuns(projectKey, workflowName));
        if (count == 0) {
            return RunPage.empty();
        }

        List<WorkflowRun> runs = storage("loadRuns", key + " offset=" + offset + " limit=" + limit,
                () -> runRepo.findPage(projectKey, workflowName, offset, limit));
        for (WorkflowRun run : runs) {
            decode(run);
            run.setTags(storage("loadRuns", "tags of run " + run.getId(),
                    () -> tagRepo.findByWorkflowRunId(run.getId())));
        }
        return new RunPage(runs, offset, limit, count);
    }

    // ------------------------------------------------------------------
    // Locking and numbering
    // ------------------------------------------------------------------

    /**
     * Joins the caller's transaction: the row lock taken here is held until
     * that transaction commits or rolls back.
     */
    @Override
    @Transactional
    public WorkflowRun loadAndLockRun(long id) {
        Optional<WorkflowRun> run;
        try {
            run = runRepo.findAndLockById(id);
        } catch (PessimisticLockingFailureException e) {
            log.debug("Workflow run {} is locked by another mutation", id);
            throw new LockConflictException(id, e);
        } catch (DataAccessException e) {
            throw new RunStoreException("loadAndLockRun failed for id=" + id, e);
        }
        return assemble(run, "id=" + id);
    }

    /**
     * Runs in its own transaction so the sequence row is released right away:
     * concurrent triggers of one workflow only serialize on this statement,
     * not on each other's whole run creation.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public long nextRunNumber(long workflowId) {
        long number = storage("nextRunNumber", "workflow=" + workflowId, () -> runRepo.nextRunNumber(workflowId));
        log.debug("nextRunNumber> workflow {} → {}", workflowId, number);
        return number;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void encode(WorkflowRun run) {
        run.setWorkflowJson(serializer.encodeSnapshot(run.getWorkflow()));
        run.setInfosJson(serializer.encodeInfos(run.getInfos()));
    }

    private void decode(WorkflowRun run) {
        run.setWorkflow(serializer.decodeSnapshot(run.getWorkflowJson()));
        run.setInfos(serializer.decodeInfos(run.getInfosJson()));
    }

    private void saveNodeRuns(long runId, WorkflowRun run) {
        List<NodeRun> all = run.allNodeRuns();
        if (all.isEmpty()) {
            return;
        }
        all.forEach(n -> n.setWorkflowRunId(runId));
        storage("saveNodeRuns", "run=" + runId, () -> nodeRunRepo.saveAll(all));
    }

    /** Decode JSON columns, attach node history (latest attempt first) and tags. */
    private WorkflowRun assemble(Optional<WorkflowRun> found, String key) {
        WorkflowRun run = found.orElseThrow(() -> new RunNotFoundException("Workflow run not found: " + key));
        decode(run);

        List<NodeRun> attempts = storage("loadNodeRuns", "run=" + run.getId(),
                () -> nodeRunRepo.findByWorkflowRunIdOrderBySubNumberDesc(run.getId()));
        Map<Long, List<NodeRun>> byNode = new LinkedHashMap<>();
        for (NodeRun attempt : attempts) {
            byNode.computeIfAbsent(attempt.getWorkflowNodeId(), k -> new ArrayList<>()).add(attempt);
        }
        byNode.values().forEach(list -> list.sort(Comparator.comparingInt(NodeRun::getSubNumber).reversed()));
        run.setNodeRuns(byNode);

        run.setTags(storage("loadTags", "run=" + run.getId(), () -> tagRepo.findByWorkflowRunId(run.getId())));
        return run;
    }

    /** Runs a repository call, wrapping storage failures with the operation and its key. */
    private static <T> T storage(String operation, String key, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new RunStoreException(operation + " failed for " + key + ": " + e.getMessage(), e);
        }
    }
}
