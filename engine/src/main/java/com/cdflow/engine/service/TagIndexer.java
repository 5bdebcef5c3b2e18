package com.cdflow.engine.service;

import com.cdflow.engine.model.RunTag;
import com.cdflow.engine.model.TriggerContext;
import com.cdflow.engine.repository.RunTagRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maintains the searchable tags of runs.
 *
 * A run's tag set is always replaced as a whole (delete, then insert) on
 * every persist, never patched.
 */
@Component
public class TagIndexer {

    public static final String TAG_GIT_BRANCH     = "git.branch";
    public static final String TAG_GIT_HASH       = "git.hash";
    public static final String TAG_GIT_REPOSITORY = "git.repository";
    public static final String TAG_GIT_AUTHOR     = "git.author";
    public static final String TAG_TRIGGERED_BY   = "triggered_by";

    private final RunTagRepository tagRepo;

    public TagIndexer(RunTagRepository tagRepo) {
        this.tagRepo = tagRepo;
    }

    /** Tags describing a trigger. Blank values are left out. */
    public List<RunTag> deriveTags(TriggerContext trigger) {
        List<RunTag> tags = new ArrayList<>();
        add(tags, TAG_GIT_BRANCH,     trigger.branch());
        add(tags, TAG_GIT_HASH,       trigger.hash());
        add(tags, TAG_GIT_REPOSITORY, trigger.repository());
        add(tags, TAG_GIT_AUTHOR,     trigger.author());
        add(tags, TAG_TRIGGERED_BY,   trigger.triggeredBy());
        new TreeMap<>(trigger.extra()).forEach((k, v) -> add(tags, k, v));
        return tags;
    }

    /**
     * Replace every tag of a run. Duplicate pairs are stored once; an empty
     * set only deletes.
     */
    @Transactional
    public void replaceTags(long runId, Collection<RunTag> tags) {
        tagRepo.deleteByRunId(runId);

        Set<RunTag> distinct = new LinkedHashSet<>();
        for (RunTag t : tags) {
            distinct.add(t.forRun(runId));
        }
        if (distinct.isEmpty()) {
            return;
        }
        tagRepo.saveAll(distinct);
    }

    /**
     * Every tag key seen on a workflow's runs, mapped to its distinct values.
     * Keys and values are sorted ascending. Feeds run-search filters.
     */
    @Transactional(readOnly = true)
    public SortedMap<String, List<String>> aggregateValues(String projectKey, String workflowName) {
        Map<String, SortedSet<String>> values = new TreeMap<>();
        for (Object[] row : tagRepo.findDistinctTagValues(projectKey, workflowName)) {
            values.computeIfAbsent((String) row[0], k -> new TreeSet<>()).add((String) row[1]);
        }

        SortedMap<String, List<String>> result = new TreeMap<>();
        values.forEach((tag, vals) -> result.put(tag, List.copyOf(vals)));
        return result;
    }

    private static void add(List<RunTag> tags, String key, String value) {
        if (key != null && !key.isBlank() && value != null && !value.isBlank()) {
            tags.add(RunTag.of(key, value));
        }
    }
}
