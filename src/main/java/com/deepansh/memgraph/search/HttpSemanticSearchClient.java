package com.deepansh.memgraph.search;

import com.deepansh.memgraph.config.MemoryProperties;
import com.deepansh.memgraph.exception.SemanticSearchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Raw HTTP client for the semantic-search service.
 *
 * Request:  POST {path} {"query": "...", "limit": n, "type": "semantic"}
 * Response: {"results": [{"content", "score", "source", "id", "timestamp"}]}
 *
 * Failures are thrown as {@link SemanticSearchException}; degrading them to
 * an empty result is left to {@link ResilientSemanticSearchClient}.
 */
@Component
@Slf4j
public class HttpSemanticSearchClient implements SemanticSearchClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final MemoryProperties.SemanticSearch config;

    public HttpSemanticSearchClient(@Qualifier("semanticSearchRestClientBuilder") RestClient.Builder builder,
                                    ObjectMapper objectMapper,
                                    MemoryProperties properties) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.config = properties.getSemanticSearch();
    }

    @Override
    public List<SemanticHit> search(String query, int limit) {
        if (!config.isEnabled()) {
            log.debug("Semantic search disabled, skipping vector path");
            return List.of();
        }

        log.debug("Semantic search: query='{}' limit={}", query, limit);
        String body;
        try {
            body = restClient.post()
                    .uri(config.getPath())
                    .body(Map.of("query", query, "limit", limit, "type", "semantic"))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new SemanticSearchException("Semantic search request failed: " + e.getMessage(), e);
        }
        return parseHits(body);
    }

    private List<SemanticHit> parseHits(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SemanticSearchException("Semantic search returned malformed JSON", e);
        }

        JsonNode results = root.path("results");
        if (!results.isArray()) {
            return List.of();
        }
        List<SemanticHit> hits = new ArrayList<>(results.size());
        for (JsonNode item : results) {
            hits.add(new SemanticHit(
                    item.path("content").asText(""),
                    item.path("score").asDouble(0.0),
                    item.path("source").asText("unknown"),
                    item.path("id").asText(""),
                    item.path("timestamp").asText("")));
        }
        log.debug("Semantic search returned {} hits", hits.size());
        return hits;
    }
}
