package com.deepansh.memgraph.api;

import com.deepansh.memgraph.dedup.DeduplicationService;
import com.deepansh.memgraph.dedup.DuplicateCheck;
import com.deepansh.memgraph.dedup.DuplicateReport;
import com.deepansh.memgraph.dedup.IndexStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/dedup")
@RequiredArgsConstructor
@Slf4j
public class DedupController {

    private final DeduplicationService deduplicationService;

    @GetMapping("/check")
    public ResponseEntity<DuplicateCheck> check(@RequestParam String text) {
        return ResponseEntity.ok(deduplicationService.checkDuplicate(text));
    }

    @PostMapping("/register")
    public ResponseEntity<Map<String, String>> register(@Valid @RequestBody RegisterContentRequest request) {
        String fingerprint = deduplicationService.registerContent(request.text(), request.source());
        return ResponseEntity.ok(Map.of("fingerprint", fingerprint));
    }

    /**
     * Rebuilds the fingerprint index from the fact store and notes.
     * POST /api/v1/dedup/rebuild
     */
    @PostMapping("/rebuild")
    public ResponseEntity<DuplicateReport> rebuild() {
        return ResponseEntity.ok(deduplicationService.rebuildIndex());
    }

    @GetMapping("/stats")
    public ResponseEntity<IndexStats> stats() {
        return ResponseEntity.ok(deduplicationService.stats());
    }

    @DeleteMapping("/index")
    public ResponseEntity<Map<String, Object>> clean() {
        boolean deleted = deduplicationService.clean();
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }
}
