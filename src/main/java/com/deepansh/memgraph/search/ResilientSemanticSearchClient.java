package com.deepansh.memgraph.search;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Circuit-breaking decorator around {@link HttpSemanticSearchClient}.
 *
 * Any failure, or an open circuit, yields an empty hit list so retrieval
 * continues on the keyword path alone.
 *
 * Circuit breaker config lives in application.yml under
 * resilience4j.circuitbreaker.instances.semanticSearch.
 */
@Component
@Primary
@Slf4j
public class ResilientSemanticSearchClient implements SemanticSearchClient {

    private final SemanticSearchClient delegate;

    public ResilientSemanticSearchClient(@Qualifier("httpSemanticSearchClient") SemanticSearchClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "semanticSearch", fallbackMethod = "unavailableFallback")
    public List<SemanticHit> search(String query, int limit) {
        return delegate.search(query, limit);
    }

    public List<SemanticHit> unavailableFallback(String query, int limit, Exception ex) {
        log.warn("Semantic search unavailable, continuing without vector results: {}", ex.getMessage());
        return List.of();
    }
}
