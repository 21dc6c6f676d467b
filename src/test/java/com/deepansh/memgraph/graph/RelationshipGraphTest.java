package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.model.Relationship;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipGraphTest {

    private static Relationship edge(String from, String to, String relation) {
        return new Relationship(from, to, relation, "2026-01-01", null);
    }

    @Test
    void traverse_cycle_terminatesAndVisitsEachOnce() {
        RelationshipGraph graph = RelationshipGraph.of(List.of(
                edge("people/a", "people/b", "knows"),
                edge("people/b", "people/a", "knows")));

        Traversal result = graph.traverse("people/a", 5, Direction.BOTH);

        assertThat(result.visitedEntities()).isEqualTo(2);
        assertThat(result.all()).isNotEmpty();
    }

    @Test
    void traverse_chain_stopsAtMaxDepth() {
        RelationshipGraph graph = RelationshipGraph.of(List.of(
                edge("people/a", "people/b", "knows"),
                edge("people/b", "people/c", "knows"),
                edge("people/c", "people/d", "knows")));

        Traversal result = graph.traverse("people/a", 1, Direction.OUT);

        assertThat(result.all()).extracting(Connection::to).containsExactly("people/b");
        assertThat(result.byDepth()).containsOnlyKeys(0);
        assertThat(result.visitedEntities()).isEqualTo(2);
    }

    @Test
    void traverse_outOnly_ignoresInboundEdges() {
        RelationshipGraph graph = RelationshipGraph.of(List.of(
                edge("people/a", "companies/acme", "works_at"),
                edge("people/z", "people/a", "knows")));

        Traversal out = graph.traverse("people/a", 2, Direction.OUT);
        Traversal in = graph.traverse("people/a", 2, Direction.IN);

        assertThat(out.all()).extracting(Connection::to).containsExactly("companies/acme");
        assertThat(out.all()).extracting(Connection::type).containsOnly(Connection.Type.OUTBOUND);
        assertThat(in.all()).extracting(Connection::from).containsExactly("people/z");
        assertThat(in.all()).extracting(Connection::type).containsOnly(Connection.Type.INBOUND);
    }

    @Test
    void traverse_parallelEdges_areAllReported() {
        RelationshipGraph graph = RelationshipGraph.of(List.of(
                edge("people/a", "people/b", "knows"),
                edge("people/a", "people/b", "mentions")));

        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.entityCount()).isEqualTo(2);
        assertThat(graph.traverse("people/a", 1, Direction.OUT).all())
                .extracting(Connection::relation).containsExactly("knows", "mentions");
    }

    @Test
    void traverse_depthZero_reportsNothing() {
        RelationshipGraph graph = RelationshipGraph.of(List.of(edge("people/a", "people/b", "knows")));

        Traversal result = graph.traverse("people/a", 0, Direction.BOTH);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.visitedEntities()).isEqualTo(1);
    }

    @Test
    void traverse_noEndpointBeyondMaxDepth() {
        List<Relationship> edges = List.of(
                edge("n/0", "n/1", "r"), edge("n/1", "n/2", "r"), edge("n/2", "n/3", "r"),
                edge("n/3", "n/4", "r"), edge("n/5", "n/2", "r"), edge("n/4", "n/0", "r"),
                edge("n/1", "n/6", "r"), edge("n/6", "n/7", "r"), edge("n/7", "n/5", "r"),
                edge("n/8", "n/7", "r"), edge("n/3", "n/3", "r"));
        RelationshipGraph graph = RelationshipGraph.of(edges);
        Map<String, Integer> distance = undirectedDistances(edges, "n/0");

        for (int maxDepth = 0; maxDepth <= 4; maxDepth++) {
            for (Connection c : graph.traverse("n/0", maxDepth, Direction.BOTH).all()) {
                assertThat(distance.get(c.from())).isLessThanOrEqualTo(maxDepth);
                assertThat(distance.get(c.to())).isLessThanOrEqualTo(maxDepth);
            }
        }
    }

    private static Map<String, Integer> undirectedDistances(List<Relationship> edges, String start) {
        Map<String, List<String>> adjacent = new HashMap<>();
        for (Relationship r : edges) {
            adjacent.computeIfAbsent(r.from(), k -> new ArrayList<>()).add(r.to());
            adjacent.computeIfAbsent(r.to(), k -> new ArrayList<>()).add(r.from());
        }
        Map<String, Integer> distance = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distance.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            for (String next : adjacent.getOrDefault(node, List.of())) {
                if (!distance.containsKey(next)) {
                    distance.put(next, distance.get(node) + 1);
                    queue.add(next);
                }
            }
        }
        return distance;
    }
}
