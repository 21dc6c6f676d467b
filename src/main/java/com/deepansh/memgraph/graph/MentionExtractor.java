package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.model.EntityKey;

import java.util.Set;

/**
 * Finds the entities a piece of text refers to.
 *
 * Relationship detection only depends on this contract, so the matching
 * heuristic can be swapped without touching graph building or traversal.
 */
public interface MentionExtractor {

    /** Candidate entity keys mentioned in the text, in a stable order. */
    Set<EntityKey> extract(String text);
}
