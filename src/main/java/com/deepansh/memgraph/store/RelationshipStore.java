package com.deepansh.memgraph.store;

import com.deepansh.memgraph.model.Relationship;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persisted edge set (patterns.json).
 */
@Component
@Slf4j
public class RelationshipStore {

    private static final TypeReference<PatternsDocument> DOCUMENT = new TypeReference<>() {};

    private final WorkspaceLayout layout;
    private final JsonFileAccess files;

    public RelationshipStore(WorkspaceLayout layout, JsonFileAccess files) {
        this.layout = layout;
        this.files = files;
    }

    public PatternsDocument load() {
        PatternsDocument doc = files.read(layout.patternsFile(), DOCUMENT, PatternsDocument::empty);
        if (doc.getRelationships() == null) {
            doc.setRelationships(new ArrayList<>());
        }
        if (doc.getBehavioralSequences() == null) {
            doc.setBehavioralSequences(new ArrayList<>());
        }
        // Edges without endpoints or label cannot be traversed or deduplicated
        doc.getRelationships().removeIf(r -> r == null
                || r.from() == null || r.to() == null || r.relation() == null);
        return doc;
    }

    public List<Relationship> loadRelationships() {
        return load().getRelationships();
    }

    public void save(PatternsDocument doc) {
        Objects.requireNonNull(doc, "doc");
        files.write(layout.patternsFile(), doc);
        log.debug("Saved {} relationships", doc.getRelationships().size());
    }
}
