package com.cdflow.engine.api;

import com.cdflow.engine.api.dto.AdvanceNodeRequest;
import com.cdflow.engine.api.dto.CreateRunRequest;
import com.cdflow.engine.api.dto.RunResponse;
import com.cdflow.engine.api.dto.StopRunRequest;
import com.cdflow.engine.model.Workflow;
import com.cdflow.engine.model.WorkflowRun;
import com.cdflow.engine.service.RunEngine;
import com.cdflow.engine.service.TagIndexer;
import com.cdflow.engine.service.ValidationException;
import com.cdflow.engine.store.RunPage;
import com.cdflow.engine.store.RunStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST adapter over the run engine.
 *
 * POST /projects/{key}/workflows/{name}/runs                 — trigger a run
 * GET  /projects/{key}/workflows/{name}/runs                 — paginated history, newest first
 * GET  /projects/{key}/workflows/{name}/runs/latest          — last run
 * GET  /projects/{key}/workflows/{name}/runs/{number}        — run by number
 * GET  /projects/{key}/workflows/{name}/runs/tags            — tag values for search filters
 * GET  /projects/{key}/runs/{id}                             — run by id, scoped to a project
 * GET  /runs/{id}                                            — run by id
 * POST /runs/{id}/nodes/{nodeId}                             — executor progress report
 * POST /runs/{id}/stop                                       — stop a run
 *
 * Error mapping lives in RunExceptionHandler.
 */
@RestController
public class RunController {

    private final RunEngine  engine;
    private final RunStore   store;
    private final TagIndexer tagIndexer;
    private final int        defaultPageSize;
    private final int        maxPageSize;

    public RunController(RunEngine engine,
                         RunStore store,
                         TagIndexer tagIndexer,
                         @Value("${cdflow.runs.default-page-size:20}") int defaultPageSize,
                         @Value("${cdflow.runs.max-page-size:50}") int maxPageSize) {
        this.engine          = engine;
        this.store           = store;
        this.tagIndexer      = tagIndexer;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize     = maxPageSize;
    }

    /**
     * Trigger a run of the given definition.
     *
     * Example:
     *   curl -X POST http://localhost:8080/projects/PROJ/workflows/HelloPipeline/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"workflow":{...},"trigger":{"branch":"main","triggeredBy":"alice"}}'
     */
    @PostMapping("/projects/{key}/workflows/{name}/runs")
    public ResponseEntity<RunResponse> createRun(@PathVariable String key,
                                                 @PathVariable String name,
                                                 @RequestBody CreateRunRequest req) {
        Workflow workflow = req.workflow();
        if (workflow == null || !key.equals(workflow.getProjectKey()) || !name.equals(workflow.getName())) {
            throw new ValidationException("Workflow definition does not match " + key + "/" + name);
        }
        WorkflowRun run = engine.createRun(workflow, req.trigger());
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    /**
     * Paginated run history. The total number of runs is returned in the
     * X-Total-Count header.
     */
    @GetMapping("/projects/{key}/workflows/{name}/runs")
    public ResponseEntity<List<RunResponse>> listRuns(@PathVariable String key,
                                                      @PathVariable String name,
                                                      @RequestParam(defaultValue = "0") int offset,
                                                      @RequestParam(required = false) Integer limit) {
        if (offset < 0) {
            throw new ValidationException("offset must not be negative");
        }
        int pageSize = limit == null ? defaultPageSize : Math.max(1, Math.min(limit, maxPageSize));
        RunPage page = store.loadRuns(key, name, offset, pageSize);
        return ResponseEntity.ok()
                .header("X-Total-Count", String.valueOf(page.total()))
                .body(page.runs().stream().map(RunResponse::from).toList());
    }

    @GetMapping("/projects/{key}/workflows/{name}/runs/latest")
    public RunResponse lastRun(@PathVariable String key, @PathVariable String name) {
        return RunResponse.from(store.loadLastRun(key, name));
    }

    @GetMapping("/projects/{key}/workflows/{name}/runs/{number:\\d+}")
    public RunResponse runByNumber(@PathVariable String key, @PathVariable String name, @PathVariable long number) {
        return RunResponse.from(store.loadRun(key, name, number));
    }

    @GetMapping("/projects/{key}/workflows/{name}/runs/tags")
    public Map<String, List<String>> tagValues(@PathVariable String key, @PathVariable String name) {
        return tagIndexer.aggregateValues(key, name);
    }

    @GetMapping("/projects/{key}/runs/{id}")
    public RunResponse runByIdInProject(@PathVariable String key, @PathVariable long id) {
        return RunResponse.from(store.loadRunByIdAndProjectKey(key, id));
    }

    @GetMapping("/runs/{id}")
    public RunResponse runById(@PathVariable long id) {
        return RunResponse.from(store.loadRunById(id));
    }

    /**
     * Executor progress report. Answers 409 when another report for the same
     * run is being applied; executors retry with backoff.
     */
    @PostMapping("/runs/{id}/nodes/{nodeId}")
    public RunResponse advanceNode(@PathVariable long id,
                                   @PathVariable long nodeId,
                                   @RequestBody AdvanceNodeRequest req) {
        return RunResponse.from(engine.advanceNode(id, nodeId, req.status(), req.infos()));
    }

    @PostMapping("/runs/{id}/stop")
    public RunResponse stopRun(@PathVariable long id, @RequestBody(required = false) StopRunRequest req) {
        String actor = req == null ? "anonymous" : req.actor();
        return RunResponse.from(engine.stopRun(id, actor));
    }
}
