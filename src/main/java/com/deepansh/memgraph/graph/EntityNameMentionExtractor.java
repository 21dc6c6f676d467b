package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.model.EntityKey;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Matches entity names as case-insensitive substrings of the text.
 *
 * Each entity is looked up under its stored name ("acme-corp") and a spaced
 * variant ("acme corp"). When two entities share a name the later one in
 * walk order owns it.
 */
public class EntityNameMentionExtractor implements MentionExtractor {

    private final Map<String, EntityKey> byName = new LinkedHashMap<>();
    private final int minNameLength;

    public EntityNameMentionExtractor(List<EntityKey> knownEntities, int minNameLength) {
        this.minNameLength = minNameLength;
        for (EntityKey key : knownEntities) {
            byName.put(key.name().toLowerCase(Locale.ROOT), key);
            byName.put(key.spacedName(), key);
        }
    }

    @Override
    public Set<EntityKey> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Set.of();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        Set<EntityKey> found = new LinkedHashSet<>();
        byName.forEach((name, key) -> {
            if (name.length() >= minNameLength && haystack.contains(name)) {
                found.add(key);
            }
        });
        return found;
    }
}
