package com.deepansh.memgraph.search;

import com.deepansh.memgraph.config.MemoryProperties;
import com.deepansh.memgraph.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fuses the keyword path with the semantic-search path.
 *
 * Each path is asked for twice the requested limit. Scores are scaled by the
 * path's weight, results are de-duplicated on the first 100 characters of
 * their lowercased content (vector hits are considered first, so they win
 * ties), then sorted by weighted score and truncated.
 *
 * Weights are independent multipliers in [0, 1]; they need not sum to 1.
 */
@Service
@Slf4j
public class HybridSearchService {

    static final int DEDUP_PREFIX_LENGTH = 100;

    private final KeywordSearchService keywordSearch;
    private final SemanticSearchClient semanticSearch;
    private final MemoryProperties.Search config;

    public HybridSearchService(KeywordSearchService keywordSearch,
                               SemanticSearchClient semanticSearch,
                               MemoryProperties properties) {
        this.keywordSearch = keywordSearch;
        this.semanticSearch = semanticSearch;
        this.config = properties.getSearch();
    }

    /**
     * Entry point for callers that pick a mode. Null arguments take the
     * configured defaults.
     */
    public List<SearchResult> search(String query, Integer limit, Double vectorWeight,
                                     Double keywordWeight, String mode) {
        int effectiveLimit = limit != null ? limit : config.getDefaultLimit();
        validate(query, effectiveLimit);

        return switch (SearchMode.fromValue(mode)) {
            case KEYWORD -> unweighted(keywordSearch.search(query, effectiveLimit), SearchType.KEYWORD, effectiveLimit);
            case VECTOR -> unweighted(vectorSearch(query, effectiveLimit), SearchType.VECTOR, effectiveLimit);
            case HYBRID -> hybridSearch(query, effectiveLimit,
                    vectorWeight != null ? vectorWeight : config.getVectorWeight(),
                    keywordWeight != null ? keywordWeight : config.getKeywordWeight());
        };
    }

    public List<SearchResult> hybridSearch(String query, int limit, double vectorWeight, double keywordWeight) {
        validate(query, limit);
        requireWeight("vectorWeight", vectorWeight);
        requireWeight("keywordWeight", keywordWeight);

        int fetch = limit > Integer.MAX_VALUE / 2 ? Integer.MAX_VALUE : limit * 2;
        List<SearchResult> vector = vectorSearch(query, fetch);
        List<SearchResult> keyword = keywordSearch.search(query, fetch);

        List<SearchResult> merged = new ArrayList<>(vector.size() + keyword.size());
        vector.forEach(r -> merged.add(weighted(r, vectorWeight, SearchType.VECTOR)));
        keyword.forEach(r -> merged.add(weighted(r, keywordWeight, SearchType.KEYWORD)));

        List<SearchResult> unique = deduplicate(merged);
        unique.sort(Comparator.comparingDouble(SearchResult::getFinalScore).reversed());
        List<SearchResult> ranked = unique.size() > limit ? new ArrayList<>(unique.subList(0, limit)) : unique;

        log.info("Hybrid search '{}' [vector={}, keyword={}, unique={}, returned={}]",
                query, vector.size(), keyword.size(), unique.size(), ranked.size());
        return ranked;
    }

    /** Semantic hits as results. Never throws: any failure means no vector results. */
    public List<SearchResult> vectorSearch(String query, int limit) {
        List<SemanticHit> hits;
        try {
            hits = semanticSearch.search(query, limit);
        } catch (RuntimeException e) {
            log.warn("Vector path failed, using keyword results only: {}", e.getMessage());
            return List.of();
        }

        List<SearchResult> results = new ArrayList<>(hits.size());
        for (SemanticHit hit : hits) {
            String content = hit.content() == null ? "" : hit.content();
            results.add(SearchResult.builder()
                    .type(ResultType.VECTOR_MATCH)
                    .entity(hit.source() == null ? "unknown" : hit.source())
                    .content(truncate(content, config.getVectorContentLength()))
                    .score(hit.score())
                    .timestamp(hit.timestamp() == null ? "" : hit.timestamp())
                    .category("semantic")
                    .source("semantic#" + (hit.id() == null ? "" : hit.id()))
                    .build());
        }
        return results;
    }

    static List<SearchResult> deduplicate(List<SearchResult> results) {
        Set<String> seen = new HashSet<>();
        List<SearchResult> unique = new ArrayList<>();
        for (SearchResult result : results) {
            if (seen.add(contentKey(result.getContent()))) {
                unique.add(result);
            }
        }
        return unique;
    }

    static String contentKey(String content) {
        String key = content == null ? "" : content.toLowerCase(Locale.ROOT).strip();
        return truncate(key, DEDUP_PREFIX_LENGTH);
    }

    private static SearchResult weighted(SearchResult result, double weight, SearchType type) {
        return result.toBuilder()
                .finalScore(result.getScore() * weight)
                .searchType(type)
                .build();
    }

    private static List<SearchResult> unweighted(List<SearchResult> results, SearchType type, int limit) {
        return results.stream()
                .limit(limit)
                .map(r -> weighted(r, 1.0, type))
                .toList();
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max) : text;
    }

    private static void validate(String query, int limit) {
        if (query == null || query.isBlank()) {
            throw new InvalidRequestException("Query must not be blank");
        }
        if (limit < 1) {
            throw new InvalidRequestException("Limit must be >= 1, got " + limit);
        }
    }

    private static void requireWeight(String name, double weight) {
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new InvalidRequestException(name + " must be between 0.0 and 1.0, got " + weight);
        }
    }
}
