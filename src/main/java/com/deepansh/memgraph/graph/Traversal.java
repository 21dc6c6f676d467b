package com.deepansh.memgraph.graph;

import java.util.List;
import java.util.SortedMap;

/**
 * Connections found from a start entity, bucketed by the depth of the visited
 * entity that reported them. Within a bucket, discovery order is kept.
 */
public record Traversal(String start, int maxDepth, Direction direction,
                        SortedMap<Integer, List<Connection>> byDepth, int visitedEntities) {

    public boolean isEmpty() {
        return byDepth.values().stream().allMatch(List::isEmpty);
    }

    public List<Connection> all() {
        return byDepth.values().stream().flatMap(List::stream).toList();
    }
}
