package com.deepansh.memgraph.search;

import java.util.List;

/**
 * Vector path of hybrid retrieval, backed by an external semantic-search service.
 */
public interface SemanticSearchClient {

    /**
     * @return hits in the service's ranking order; empty when the service is disabled
     */
    List<SemanticHit> search(String query, int limit);
}
