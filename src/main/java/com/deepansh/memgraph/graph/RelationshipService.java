package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.config.MemoryProperties;
import com.deepansh.memgraph.exception.EntityNotFoundException;
import com.deepansh.memgraph.exception.InvalidRequestException;
import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.model.Relationship;
import com.deepansh.memgraph.store.FactStore;
import com.deepansh.memgraph.store.PatternsDocument;
import com.deepansh.memgraph.store.RelationshipStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Relationship graph operations over the persisted edge set.
 *
 * The persisted edges are the source of truth; every traversal builds a
 * fresh {@link RelationshipGraph} snapshot from them.
 */
@Service
@Slf4j
public class RelationshipService {

    private final RelationshipStore relationshipStore;
    private final RelationshipDetector detector;
    private final FactStore factStore;
    private final MemoryProperties properties;
    private final Clock clock;

    public RelationshipService(RelationshipStore relationshipStore,
                               RelationshipDetector detector,
                               FactStore factStore,
                               MemoryProperties properties,
                               Clock clock) {
        this.relationshipStore = relationshipStore;
        this.detector = detector;
        this.factStore = factStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Adds an explicit edge.
     * @return false without writing when (from, to, relation) already exists
     */
    public boolean addRelationship(String from, String to, String relation, String since) {
        String fromKey = EntityKey.parse(from).toString();
        String toKey = EntityKey.parse(to).toString();
        if (relation == null || relation.isBlank()) {
            throw new InvalidRequestException("Relation must not be blank");
        }
        String label = relation.trim();

        PatternsDocument doc = relationshipStore.load();
        boolean exists = doc.getRelationships().stream()
                .anyMatch(r -> r.from().equals(fromKey) && r.to().equals(toKey) && r.relation().equals(label));
        if (exists) {
            log.info("Relationship already exists: {} -> {} ({})", fromKey, toKey, label);
            return false;
        }

        String effectiveSince = since != null && !since.isBlank() ? since : LocalDate.now(clock).toString();
        doc.getRelationships().add(new Relationship(fromKey, toKey, label, effectiveSince, null));
        relationshipStore.save(doc);
        log.info("Added relationship: {} -> {} ({})", fromKey, toKey, label);
        return true;
    }

    public List<Relationship> listRelationships() {
        return relationshipStore.loadRelationships();
    }

    /** Detects edges from facts and notes without persisting them. */
    public List<Relationship> detectRelationships() {
        return detector.detect();
    }

    /** Detects edges and persists the ones whose (from, to, relation) is new. */
    public MergeResult scanAndMerge() {
        List<Relationship> detected = detector.detect();
        PatternsDocument doc = relationshipStore.load();

        Set<String> existing = doc.getRelationships().stream()
                .map(Relationship::dedupKey)
                .collect(Collectors.toCollection(HashSet::new));
        List<Relationship> fresh = detected.stream()
                .filter(r -> existing.add(r.dedupKey()))
                .toList();

        if (!fresh.isEmpty()) {
            doc.getRelationships().addAll(fresh);
            relationshipStore.save(doc);
        }
        log.info("Merged {} new relationships ({} detected, {} total)",
                fresh.size(), detected.size(), doc.getRelationships().size());
        return new MergeResult(detected.size(), fresh.size(), doc.getRelationships().size());
    }

    /**
     * Walks the graph from {@code start}. An entity that has facts but no edges
     * yields an empty traversal; a key known to neither store is rejected.
     */
    public Traversal traverse(String start, Integer maxDepth, String direction) {
        EntityKey startEntity = EntityKey.parse(start);
        String startKey = startEntity.toString();
        int depth = maxDepth != null ? maxDepth : properties.getGraph().getDefaultDepth();
        if (depth < 0) {
            throw new InvalidRequestException("Traversal depth must be >= 0, got " + depth);
        }
        Direction dir = Direction.fromValue(direction);

        RelationshipGraph graph = RelationshipGraph.of(relationshipStore.loadRelationships());
        if (!graph.contains(startKey) && !factStore.exists(startEntity)) {
            throw new EntityNotFoundException("Unknown entity: " + startKey);
        }
        Traversal traversal = graph.traverse(startKey, depth, dir);
        log.debug("Traversed from {} [depth={}, direction={}] -> {} connections over {} entities",
                startKey, depth, dir, traversal.all().size(), traversal.visitedEntities());
        return traversal;
    }

    public GraphStats stats() {
        List<Relationship> relationships = relationshipStore.loadRelationships();

        Map<String, Integer> byRelation = new TreeMap<>();
        Map<String, Integer> byTypes = new TreeMap<>();
        for (Relationship r : relationships) {
            byRelation.merge(r.relation(), 1, Integer::sum);
            byTypes.merge(typeOf(r.from()) + " -> " + typeOf(r.to()), 1, Integer::sum);
        }
        return new GraphStats(relationships.size(), sortedByCount(byRelation, Integer.MAX_VALUE),
                sortedByCount(byTypes, 10));
    }

    /**
     * Entity keys grouped by type. Includes entities known only as
     * relationship endpoints.
     */
    public Map<String, List<String>> listEntities() {
        Set<String> keys = new TreeSet<>();
        factStore.listEntities().forEach(k -> keys.add(k.toString()));
        for (Relationship r : relationshipStore.loadRelationships()) {
            keys.add(r.from());
            keys.add(r.to());
        }
        Map<String, List<String>> byType = new TreeMap<>();
        for (String key : keys) {
            byType.computeIfAbsent(typeOf(key), t -> new ArrayList<>()).add(key);
        }
        return byType;
    }

    private static String typeOf(String key) {
        int slash = key.indexOf('/');
        return slash > 0 ? key.substring(0, slash) : key;
    }

    private static Map<String, Integer> sortedByCount(Map<String, Integer> counts, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));
    }
}
