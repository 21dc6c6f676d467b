package com.deepansh.memgraph.api;

import com.deepansh.memgraph.graph.GraphStats;
import com.deepansh.memgraph.graph.MergeResult;
import com.deepansh.memgraph.graph.RelationshipService;
import com.deepansh.memgraph.graph.Traversal;
import com.deepansh.memgraph.model.Relationship;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/graph")
@RequiredArgsConstructor
@Slf4j
public class GraphController {

    private final RelationshipService relationshipService;

    // ─── Edges ───────────────────────────────────────────────────────────────

    @GetMapping("/relationships")
    public ResponseEntity<List<Relationship>> listRelationships() {
        return ResponseEntity.ok(relationshipService.listRelationships());
    }

    @PostMapping("/relationships")
    public ResponseEntity<Map<String, Object>> addRelationship(@Valid @RequestBody RelationshipRequest request) {
        boolean added = relationshipService.addRelationship(
                request.from(), request.to(), request.relation(), request.since());
        return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK)
                .body(Map.of("added", added));
    }

    /** Dry run of auto-detection; nothing is persisted. */
    @GetMapping("/relationships/detected")
    public ResponseEntity<List<Relationship>> detectRelationships() {
        return ResponseEntity.ok(relationshipService.detectRelationships());
    }

    @PostMapping("/scan")
    public ResponseEntity<MergeResult> scan() {
        return ResponseEntity.ok(relationshipService.scanAndMerge());
    }

    // ─── Traversal ───────────────────────────────────────────────────────────

    @GetMapping("/connections")
    public ResponseEntity<Traversal> connections(@RequestParam String entity,
                                                 @RequestParam(required = false) Integer depth,
                                                 @RequestParam(required = false) String direction) {
        return ResponseEntity.ok(relationshipService.traverse(entity, depth, direction));
    }

    @GetMapping("/stats")
    public ResponseEntity<GraphStats> stats() {
        return ResponseEntity.ok(relationshipService.stats());
    }
}
