package com.cdflow.engine.service;

import com.cdflow.engine.model.RunTag;
import com.cdflow.engine.model.TriggerContext;
import com.cdflow.engine.repository.RunTagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TagIndexer. The tag table is a Mockito mock.
 */
@ExtendWith(MockitoExtension.class)
class TagIndexerTest {

    @Mock RunTagRepository tagRepo;

    TagIndexer indexer;

    @BeforeEach
    void setUp() {
        indexer = new TagIndexer(tagRepo);
    }

    // ------------------------------------------------------------------
    // deriveTags()
    // ------------------------------------------------------------------

    @Test
    void deriveTags_fullContext_producesGitAndTriggerTags() {
        TriggerContext ctx = new TriggerContext("main", "abc123", "github.com/org/repo",
                "alice", "bob", Map.of("env", "prod"));

        List<RunTag> tags = indexer.deriveTags(ctx);

        assertThat(tags).extracting(RunTag::toString).containsExactly(
                "git.branch=main",
                "git.hash=abc123",
                "git.repository=github.com/org/repo",
                "git.author=alice",
                "triggered_by=bob",
                "env=prod");
    }

    @Test
    void deriveTags_blankValues_areSkipped() {
        TriggerContext ctx = new TriggerContext("", null, null, " ", "bob", null);

        assertThat(indexer.deriveTags(ctx)).extracting(RunTag::toString).containsExactly("triggered_by=bob");
    }

    @Test
    void deriveTags_extraEntriesWithoutValue_areDropped() {
        Map<String, String> extra = new HashMap<>();
        extra.put("env", "prod");
        extra.put("ticket", null);
        extra.put(null, "orphan");

        TriggerContext ctx = new TriggerContext("main", null, null, null, "bob", extra);

        assertThat(ctx.extra()).containsOnlyKeys("env");
        assertThat(indexer.deriveTags(ctx)).extracting(RunTag::toString)
                .containsExactly("git.branch=main", "triggered_by=bob", "env=prod");
    }

    // ------------------------------------------------------------------
    // replaceTags()
    // ------------------------------------------------------------------

    @Test
    void replaceTags_deletesThenInsertsDistinctPairsBoundToTheRun() {
        indexer.replaceTags(7L, List.of(
                RunTag.of("git.branch", "main"),
                RunTag.of("git.branch", "main"),
                RunTag.of("triggered_by", "bob")));

        InOrder order = inOrder(tagRepo);
        order.verify(tagRepo).deleteByRunId(7L);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<RunTag>> captor = ArgumentCaptor.forClass(Collection.class);
        order.verify(tagRepo).saveAll(captor.capture());

        assertThat(captor.getValue()).containsExactly(
                new RunTag(7L, "git.branch", "main"),
                new RunTag(7L, "triggered_by", "bob"));
    }

    @Test
    void replaceTags_sameSetTwice_storesTheSameRows() {
        List<RunTag> tags = List.of(RunTag.of("git.branch", "main"), RunTag.of("git.hash", "abc123"));

        indexer.replaceTags(7L, tags);
        indexer.replaceTags(7L, tags);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<RunTag>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(tagRepo, times(2)).deleteByRunId(7L);
        verify(tagRepo, times(2)).saveAll(captor.capture());
        List<Collection<RunTag>> calls = captor.getAllValues();
        assertThat(new ArrayList<>(calls.get(1))).isEqualTo(new ArrayList<>(calls.get(0)));
        assertThat(calls.get(1)).hasSize(2);
    }

    @Test
    void replaceTags_emptySet_onlyDeletes() {
        indexer.replaceTags(7L, List.of());

        verify(tagRepo).deleteByRunId(7L);
        verify(tagRepo, never()).saveAll(any());
    }

    // ------------------------------------------------------------------
    // aggregateValues()
    // ------------------------------------------------------------------

    @Test
    void aggregateValues_groupsAndSortsDistinctValuesPerKey() {
        when(tagRepo.findDistinctTagValues("PROJ", "HelloPipeline")).thenReturn(List.<Object[]>of(
                new Object[]{"branch", "main"},
                new Object[]{"git.author", "alice"},
                new Object[]{"branch", "dev"}));

        SortedMap<String, List<String>> values = indexer.aggregateValues("PROJ", "HelloPipeline");

        assertThat(values.keySet()).containsExactly("branch", "git.author");
        assertThat(values.get("branch")).containsExactly("dev", "main");
        assertThat(values.get("git.author")).containsExactly("alice");
    }

    @Test
    void aggregateValues_branchMainAndDev_returnsSortedBranchValues() {
        when(tagRepo.findDistinctTagValues("PROJ", "HelloPipeline")).thenReturn(List.<Object[]>of(
                new Object[]{"branch", "main"},
                new Object[]{"branch", "dev"}));

        assertThat(indexer.aggregateValues("PROJ", "HelloPipeline"))
                .isEqualTo(Map.of("branch", List.of("dev", "main")));
    }

    @Test
    void aggregateValues_noRuns_returnsEmptyMap() {
        when(tagRepo.findDistinctTagValues("PROJ", "Unknown")).thenReturn(List.of());

        assertThat(indexer.aggregateValues("PROJ", "Unknown")).isEmpty();
    }
}
