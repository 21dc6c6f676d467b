package com.deepansh.memgraph.search;

/** A single hit as returned by the semantic-search service. */
public record SemanticHit(String content, double score, String source, String id, String timestamp) {
}
