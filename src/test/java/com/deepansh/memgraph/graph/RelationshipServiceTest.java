package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.exception.EntityNotFoundException;
import com.deepansh.memgraph.exception.InvalidRequestException;
import com.deepansh.memgraph.model.Relationship;
import com.deepansh.memgraph.store.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.deepansh.memgraph.store.TestWorkspace.fact;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

class RelationshipServiceTest {

    @TempDir
    Path tempDir;

    private TestWorkspace ws;
    private RelationshipService service;

    @BeforeEach
    void setUp() {
        ws = new TestWorkspace(tempDir);
        RelationshipDetector detector = new RelationshipDetector(ws.factStore, ws.noteStore,
                new EntityNameMentionExtractorFactory(), TestWorkspace.CLOCK);
        service = new RelationshipService(ws.relationshipStore, detector, ws.factStore,
                ws.properties, TestWorkspace.CLOCK);
    }

    @Test
    void addRelationship_twice_storesOneEdge() {
        assertThat(service.addRelationship("people/a", "people/b", "knows", null)).isTrue();
        assertThat(service.addRelationship("people/a", "people/b", "knows", "2020-01-01")).isFalse();

        List<Relationship> stored = service.listRelationships();
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).since()).isEqualTo("2026-03-01");
    }

    @Test
    void addRelationship_sameEndpointsOtherLabel_isSeparateEdge() {
        service.addRelationship("people/a", "people/b", "knows", null);
        assertThat(service.addRelationship("people/a", "people/b", "manages", null)).isTrue();
        assertThat(service.listRelationships()).hasSize(2);
    }

    @Test
    void addRelationship_malformedKey_rejected() {
        assertThatThrownBy(() -> service.addRelationship("nobody", "people/b", "knows", null))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(ws.layout.patternsFile()).doesNotExist();
    }

    @Test
    void detectRelationships_worksAtFact_producesTypedEdge() {
        ws.facts("people/john", fact("j1", "John works at Acme Corp"))
          .facts("companies/acme", fact("c1", "Makes anvils"));

        List<Relationship> detected = service.detectRelationships();

        assertThat(detected).extracting(Relationship::from, Relationship::to, Relationship::relation)
                .contains(tuple("people/john", "companies/acme", "works_at"),
                          tuple("people/john", "companies/acme", "mentions"));
        assertThat(detected).filteredOn(r -> r.relation().equals("works_at"))
                .extracting(Relationship::source)
                .containsExactly("life/areas/people/john/items.json#j1");
    }

    @Test
    void detectRelationships_shortNamesOnlyMatchTypedPass() {
        ws.facts("people/al", fact("a1", "Met bob at the fair"))
          .facts("people/bob", fact("b1", "Bob knows al from school"));

        List<Relationship> detected = service.detectRelationships();

        assertThat(detected).extracting(Relationship::from, Relationship::to, Relationship::relation)
                .containsExactly(tuple("people/bob", "people/al", "knows"));
    }

    @Test
    void detectRelationships_noteCoMentions_arePairwise() {
        ws.facts("people/anna", fact("a1", "Designer"))
          .facts("people/bruno", fact("b1", "Engineer"))
          .facts("projects/apollo", fact("p1", "Rocket"))
          .note("2026-02-14", "Anna and Bruno reviewed apollo today.");

        List<Relationship> coMentioned = service.detectRelationships().stream()
                .filter(r -> r.relation().equals(Relationship.CO_MENTIONED))
                .toList();

        assertThat(coMentioned).hasSize(3);
        assertThat(coMentioned).extracting(Relationship::since).containsOnly("2026-02-14");
        assertThat(coMentioned).extracting(Relationship::source).containsOnly("memory/2026-02-14.md");
    }

    @Test
    void scanAndMerge_addsOnlyNewEdges() {
        ws.facts("people/john", fact("j1", "John works at Acme Corp"))
          .facts("companies/acme", fact("c1", "Makes anvils"));
        service.addRelationship("people/john", "companies/acme", "works_at", "2024-05-01");

        MergeResult first = service.scanAndMerge();
        MergeResult second = service.scanAndMerge();

        assertThat(first.detected()).isEqualTo(2);
        assertThat(first.added()).isEqualTo(1);
        assertThat(first.total()).isEqualTo(2);
        assertThat(second.added()).isZero();
        assertThat(service.listRelationships())
                .filteredOn(r -> r.relation().equals("works_at"))
                .extracting(Relationship::since).containsExactly("2024-05-01");
    }

    @Test
    void traverse_usesConfiguredDefaultDepthAndDirection() {
        service.addRelationship("people/a", "people/b", "knows", null);
        service.addRelationship("people/b", "people/c", "knows", null);
        service.addRelationship("people/c", "people/d", "knows", null);

        Traversal result = service.traverse("people/a", null, null);

        assertThat(result.maxDepth()).isEqualTo(2);
        assertThat(result.direction()).isEqualTo(Direction.BOTH);
        assertThat(result.all()).extracting(Connection::to).doesNotContain("people/d");
    }

    @Test
    void traverse_invalidInput_rejected() {
        assertThatThrownBy(() -> service.traverse("people/a", -1, null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.traverse("people/a", 1, "sideways"))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void traverse_unknownEntity_rejected() {
        service.addRelationship("people/a", "people/b", "knows", null);

        assertThatThrownBy(() -> service.traverse("people/ghost", 2, "both"))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining("people/ghost");
    }

    @Test
    void traverse_entityWithFactsButNoEdges_isEmpty() {
        ws.facts("people/loner", fact("l1", "Keeps to themselves"));
        service.addRelationship("people/a", "people/b", "knows", null);

        Traversal result = service.traverse("people/loner", 2, "both");

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.visitedEntities()).isZero();
    }

    @Test
    void stats_countsByRelationAndTypePair() {
        service.addRelationship("people/a", "people/b", "knows", null);
        service.addRelationship("people/c", "people/b", "knows", null);
        service.addRelationship("people/a", "companies/x", "works_at", null);

        GraphStats stats = service.stats();

        assertThat(stats.totalRelationships()).isEqualTo(3);
        assertThat(stats.byRelation()).containsExactly(
                entry("knows", 2),
                entry("works_at", 1));
        assertThat(stats.byEntityType()).containsEntry("people -> people", 2);
    }

    @Test
    void listEntities_includesRelationshipEndpoints() {
        ws.facts("people/john", fact("j1", "Runs marathons"));
        service.addRelationship("people/john", "companies/acme", "works_at", null);

        assertThat(service.listEntities())
                .containsEntry("people", List.of("people/john"))
                .containsEntry("companies", List.of("companies/acme"));
    }
}
