package com.deepansh.memgraph.model;

import com.deepansh.memgraph.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Stable identifier of an entity, rendered as {@code type/name}.
 *
 * Names are normalized exactly once, in {@link #of(String, String)}.
 * {@link #parse(String)} takes a key that is already stable and never rewrites it.
 */
public record EntityKey(String type, String name) {

    public EntityKey {
        if (type == null || type.isBlank() || type.contains("/")) {
            throw new InvalidRequestException("Entity type must be a non-empty segment, got '" + type + "'");
        }
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("Entity name must not be empty");
        }
    }

    /** Creates a key for a new entity, normalizing the display name into its stored form. */
    public static EntityKey of(String type, String displayName) {
        if (displayName == null) {
            throw new InvalidRequestException("Entity name must not be empty");
        }
        String normalized = displayName.trim()
                .toLowerCase(Locale.ROOT)
                .replace(' ', '-')
                .replace(".", "");
        return new EntityKey(type == null ? null : type.trim().toLowerCase(Locale.ROOT), normalized);
    }

    @JsonCreator
    public static EntityKey parse(String key) {
        if (key == null) {
            throw new InvalidRequestException("Entity key must not be null");
        }
        int slash = key.indexOf('/');
        if (slash <= 0 || slash == key.length() - 1) {
            throw new InvalidRequestException("Entity key must look like 'type/name', got '" + key + "'");
        }
        return new EntityKey(key.substring(0, slash), key.substring(slash + 1));
    }

    /** Name with underscores and hyphens turned into spaces, as it tends to appear in prose. */
    public String spacedName() {
        return name.toLowerCase(Locale.ROOT).replaceAll("[_-]", " ");
    }

    @JsonValue
    @Override
    public String toString() {
        return type + "/" + name;
    }
}
