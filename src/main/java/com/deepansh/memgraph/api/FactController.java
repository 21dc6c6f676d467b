package com.deepansh.memgraph.api;

import com.deepansh.memgraph.dedup.FactDraft;
import com.deepansh.memgraph.dedup.FactIngestionService;
import com.deepansh.memgraph.dedup.WriteOutcome;
import com.deepansh.memgraph.exception.EntityNotFoundException;
import com.deepansh.memgraph.graph.RelationshipService;
import com.deepansh.memgraph.model.EntityKey;
import com.deepansh.memgraph.model.Fact;
import com.deepansh.memgraph.salience.SalienceService;
import com.deepansh.memgraph.salience.ScoredFact;
import com.deepansh.memgraph.store.FactStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/entities")
@RequiredArgsConstructor
@Slf4j
public class FactController {

    private final FactIngestionService factIngestionService;
    private final SalienceService salienceService;
    private final RelationshipService relationshipService;
    private final FactStore factStore;

    // ─── Entities ────────────────────────────────────────────────────────────

    @GetMapping
    public ResponseEntity<Map<String, List<String>>> listEntities() {
        return ResponseEntity.ok(relationshipService.listEntities());
    }

    // ─── Facts ───────────────────────────────────────────────────────────────

    @GetMapping("/{type}/{name}/facts")
    public ResponseEntity<List<Fact>> listFacts(@PathVariable String type, @PathVariable String name) {
        EntityKey entity = EntityKey.of(type, name);
        if (!factStore.exists(entity)) {
            throw new EntityNotFoundException("Unknown entity: " + entity);
        }
        return ResponseEntity.ok(factIngestionService.listFacts(entity));
    }

    /**
     * Dedup-gated write. 201 when stored, 200 with the duplicate outcome otherwise.
     */
    @PostMapping("/{type}/{name}/facts")
    public ResponseEntity<WriteOutcome> addFact(@PathVariable String type,
                                                @PathVariable String name,
                                                @Valid @RequestBody FactDraft draft) {
        WriteOutcome outcome = factIngestionService.addFact(EntityKey.of(type, name), draft);
        return ResponseEntity.status(outcome.added() ? HttpStatus.CREATED : HttpStatus.OK).body(outcome);
    }

    @PostMapping("/{type}/{name}/facts/{factId}/access")
    public ResponseEntity<Fact> recordAccess(@PathVariable String type,
                                             @PathVariable String name,
                                             @PathVariable String factId) {
        return ResponseEntity.ok(salienceService.recordAccess(EntityKey.of(type, name), factId));
    }

    // ─── Salience ranking ────────────────────────────────────────────────────

    @GetMapping("/{type}/{name}/salience")
    public ResponseEntity<List<ScoredFact>> rankBySalience(@PathVariable String type,
                                                           @PathVariable String name,
                                                           @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(salienceService.rankByScore(EntityKey.of(type, name), limit));
    }
}
