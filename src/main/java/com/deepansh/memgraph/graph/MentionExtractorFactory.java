package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.model.EntityKey;

import java.util.List;

/**
 * Builds a {@link MentionExtractor} over the entities known at detection time.
 */
public interface MentionExtractorFactory {

    /**
     * @param minNameLength names shorter than this never match, which keeps
     *                      short names like "al" from matching inside other words
     */
    MentionExtractor forEntities(List<EntityKey> knownEntities, int minNameLength);
}
