package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.model.Relationship;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable in-memory view of the edge set.
 *
 * Entity keys are interned to dense indices once at build time; adjacency is
 * held as int arrays of edge indices per node, so traversal never hashes a
 * string after the start lookup. Parallel edges with different labels are
 * kept (the graph is a multigraph).
 */
public final class RelationshipGraph {

    private static final int[] NO_EDGES = new int[0];

    private final List<Relationship> edges;
    private final Map<String, Integer> indexOf = new HashMap<>();
    private final int[] edgeFrom;
    private final int[] edgeTo;
    private final int[][] outgoing;
    private final int[][] incoming;

    private RelationshipGraph(List<Relationship> relationships) {
        this.edges = List.copyOf(relationships);
        this.edgeFrom = new int[edges.size()];
        this.edgeTo = new int[edges.size()];

        List<List<Integer>> out = new ArrayList<>();
        List<List<Integer>> in = new ArrayList<>();
        for (int e = 0; e < edges.size(); e++) {
            Relationship rel = edges.get(e);
            int from = intern(rel.from(), out, in);
            int to = intern(rel.to(), out, in);
            edgeFrom[e] = from;
            edgeTo[e] = to;
            out.get(from).add(e);
            in.get(to).add(e);
        }
        this.outgoing = toArrays(out);
        this.incoming = toArrays(in);
    }

    public static RelationshipGraph of(List<Relationship> relationships) {
        return new RelationshipGraph(relationships);
    }

    public int entityCount() {
        return indexOf.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean contains(String entityKey) {
        return indexOf.containsKey(entityKey);
    }

    /**
     * Breadth-first traversal from {@code start}.
     *
     * Every entity is expanded at most once, so cycles terminate. An entity
     * at depth d reports its edges under bucket d; entities are discovered at
     * d + 1 only while d < maxDepth. Edges leading to an entity that was never
     * discovered are not reported, which keeps every reported endpoint within
     * maxDepth of the start.
     */
    public Traversal traverse(String start, int maxDepth, Direction direction) {
        SortedMap<Integer, List<Connection>> byDepth = new TreeMap<>();
        Integer startIndex = indexOf.get(start);
        if (startIndex == null) {
            return new Traversal(start, maxDepth, direction, byDepth, 0);
        }

        int[] depth = new int[indexOf.size()];
        Arrays.fill(depth, -1);
        Deque<Integer> queue = new ArrayDeque<>();
        depth[startIndex] = 0;
        queue.add(startIndex);
        int visited = 0;

        while (!queue.isEmpty()) {
            int node = queue.poll();
            int d = depth[node];
            boolean expand = d < maxDepth;
            visited++;

            if (direction.followsOutbound()) {
                for (int e : outgoing[node]) {
                    if (discover(edgeTo[e], d, expand, depth, queue)) {
                        bucket(byDepth, d).add(connection(edges.get(e), Connection.Type.OUTBOUND));
                    }
                }
            }
            if (direction.followsInbound()) {
                for (int e : incoming[node]) {
                    if (discover(edgeFrom[e], d, expand, depth, queue)) {
                        bucket(byDepth, d).add(connection(edges.get(e), Connection.Type.INBOUND));
                    }
                }
            }
        }
        return new Traversal(start, maxDepth, direction, byDepth, visited);
    }

    /** @return whether the neighbor is (now) within reach and its edge should be reported */
    private static boolean discover(int neighbor, int d, boolean expand, int[] depth, Deque<Integer> queue) {
        if (depth[neighbor] >= 0) {
            return true;
        }
        if (!expand) {
            return false;
        }
        depth[neighbor] = d + 1;
        queue.add(neighbor);
        return true;
    }

    private static List<Connection> bucket(SortedMap<Integer, List<Connection>> byDepth, int depth) {
        return byDepth.computeIfAbsent(depth, k -> new ArrayList<>());
    }

    private static Connection connection(Relationship rel, Connection.Type type) {
        return new Connection(rel.from(), rel.to(), type, rel.relation(), rel.since(), rel.source());
    }

    private int intern(String key, List<List<Integer>> out, List<List<Integer>> in) {
        Integer existing = indexOf.get(key);
        if (existing != null) {
            return existing;
        }
        int index = indexOf.size();
        indexOf.put(key, index);
        out.add(new ArrayList<>());
        in.add(new ArrayList<>());
        return index;
    }

    private static int[][] toArrays(List<List<Integer>> lists) {
        int[][] result = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            List<Integer> list = lists.get(i);
            result[i] = list.isEmpty() ? NO_EDGES : list.stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }
}
