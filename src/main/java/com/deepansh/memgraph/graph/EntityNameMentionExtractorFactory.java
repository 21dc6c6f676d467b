package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.model.EntityKey;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EntityNameMentionExtractorFactory implements MentionExtractorFactory {

    @Override
    public MentionExtractor forEntities(List<EntityKey> knownEntities, int minNameLength) {
        return new EntityNameMentionExtractor(knownEntities, minNameLength);
    }
}
