package com.deepansh.memgraph.api;

import com.deepansh.memgraph.search.HybridSearchService;
import com.deepansh.memgraph.search.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

    private final HybridSearchService hybridSearchService;

    /**
     * GET /api/v1/search?q=acme&limit=5&mode=hybrid
     * Omitted weights and limit fall back to configuration.
     */
    @GetMapping
    public ResponseEntity<List<SearchResult>> search(@RequestParam String q,
                                                     @RequestParam(required = false) Integer limit,
                                                     @RequestParam(required = false) Double vectorWeight,
                                                     @RequestParam(required = false) Double keywordWeight,
                                                     @RequestParam(required = false) String mode) {
        return ResponseEntity.ok(hybridSearchService.search(q, limit, vectorWeight, keywordWeight, mode));
    }
}
