package com.deepansh.memgraph.dedup;

import com.deepansh.memgraph.exception.InvalidRequestException;
import com.deepansh.memgraph.model.Fact;
import com.deepansh.memgraph.model.FactStatus;
import com.deepansh.memgraph.model.IndexEntry;
import com.deepansh.memgraph.store.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static com.deepansh.memgraph.store.TestWorkspace.fact;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeduplicationServiceTest {

    @TempDir
    Path tempDir;

    private TestWorkspace ws;
    private DeduplicationService service;

    @BeforeEach
    void setUp() {
        ws = new TestWorkspace(tempDir);
        service = new DeduplicationService(new ContentNormalizer(), ws.indexStore, ws.factStore,
                ws.noteStore, ws.properties, TestWorkspace.CLOCK);
    }

    @Test
    void registerContent_variantTwice_yieldsOneEntry() {
        String first = service.registerContent("Met with John Smith.", "memory/2026-02-01.md");
        DuplicateCheck check = service.checkDuplicate("met with   john smith");
        String second = service.registerContent("met with   john smith", "memory/2026-02-02.md");

        assertThat(second).isEqualTo(first);
        assertThat(check.isDuplicate()).isTrue();
        assertThat(check.originalSource()).isEqualTo("memory/2026-02-01.md");

        Map<String, IndexEntry> index = ws.indexStore.load();
        assertThat(index).hasSize(1);
        assertThat(index.get(first).source()).isEqualTo("memory/2026-02-01.md");
        assertThat(index.get(first).firstSeen()).startsWith("2026-03-01T10:00");
    }

    @Test
    void checkDuplicate_unknownContent_doesNotMutateIndex() {
        DuplicateCheck check = service.checkDuplicate("Never seen before");

        assertThat(check.isDuplicate()).isFalse();
        assertThat(check.firstSeen()).isNull();
        assertThat(ws.indexStore.location()).doesNotExist();
    }

    @Test
    void checkDuplicate_corruptIndex_treatedAsEmpty() {
        ws.write(ws.indexStore.location(), "[[[");
        assertThat(service.checkDuplicate("anything").isDuplicate()).isFalse();
    }

    @Test
    void checkDuplicate_blankText_rejected() {
        assertThatThrownBy(() -> service.checkDuplicate("  "))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void rebuildIndex_firstOccurrenceWins_inWalkOrder() {
        Fact superseded = fact("s1", "Drives a red car");
        superseded.setStatus(FactStatus.SUPERSEDED);
        ws.facts("people/anna", fact("a1", "Likes hiking in the Alps"), superseded)
          .facts("people/bob", fact("b1", "likes hiking in alps"))
          .note("2026-02-10", "Short one.\n\nAnna said she likes hiking in the Alps!\n\nDrives a red car for sure.");

        DuplicateReport report = service.rebuildIndex();

        // a1, b1, two long paragraphs; superseded fact and short paragraph skipped
        assertThat(report.totalProcessed()).isEqualTo(4);
        assertThat(report.duplicates()).hasSize(1);
        DuplicateEntry dup = report.duplicates().get(0);
        assertThat(dup.originalSource()).isEqualTo("life/areas/people/anna/items.json");
        assertThat(dup.duplicateSource()).isEqualTo("life/areas/people/bob/items.json");
        assertThat(report.indexSize()).isEqualTo(3);
        assertThat(ws.indexStore.load()).hasSize(3);
    }

    @Test
    void stats_groupsBySourceType() {
        service.registerContent("Fact one text", "life/areas/people/a/items.json");
        service.registerContent("Note paragraph text", "memory/2026-01-01.md");
        service.registerContent("Imported text", "import");

        IndexStats stats = service.stats();

        assertThat(stats.totalEntries()).isEqualTo(3);
        assertThat(stats.bySourceType()).containsEntry("items.json", 1)
                .containsEntry("daily_notes", 1)
                .containsEntry("other", 1);
        assertThat(stats.sizeBytes()).isPositive();
    }

    @Test
    void clean_removesIndexFile() {
        service.registerContent("Something", "import");
        assertThat(service.clean()).isTrue();
        assertThat(service.clean()).isFalse();
    }
}
