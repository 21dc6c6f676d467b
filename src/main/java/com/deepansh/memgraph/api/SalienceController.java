package com.deepansh.memgraph.api;

import com.deepansh.memgraph.exception.InvalidRequestException;
import com.deepansh.memgraph.salience.MigrationReport;
import com.deepansh.memgraph.salience.SalienceScorer;
import com.deepansh.memgraph.salience.SalienceService;
import com.deepansh.memgraph.salience.SalienceStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/salience")
@RequiredArgsConstructor
@Slf4j
public class SalienceController {

    private final SalienceService salienceService;
    private final SalienceScorer salienceScorer;

    /** Scores an arbitrary (lastAccessed, accessCount) pair without touching the store. */
    @GetMapping("/score")
    public ResponseEntity<Map<String, Object>> score(@RequestParam String lastAccessed,
                                                     @RequestParam(defaultValue = "1") int accessCount) {
        if (accessCount < 0) {
            throw new InvalidRequestException("accessCount must be >= 0, got " + accessCount);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("lastAccessed", lastAccessed);
        body.put("accessCount", accessCount);
        body.put("recencyWeight", salienceScorer.recencyWeight(lastAccessed));
        body.put("frequencyWeight", salienceScorer.frequencyWeight(accessCount));
        body.put("score", salienceScorer.score(lastAccessed, accessCount));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats")
    public ResponseEntity<SalienceStats> stats() {
        return ResponseEntity.ok(salienceService.stats());
    }

    /**
     * Back-fills access tracking fields on legacy facts.
     * POST /api/v1/salience/migrate
     */
    @PostMapping("/migrate")
    public ResponseEntity<MigrationReport> migrate() {
        return ResponseEntity.ok(salienceService.migrate());
    }
}
