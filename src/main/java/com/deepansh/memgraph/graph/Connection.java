package com.deepansh.memgraph.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * One edge reported by a traversal, seen from the entity that was being visited.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Connection(String from, String to, Type type, String relation, String since, String source) {

    public enum Type {
        OUTBOUND,
        INBOUND;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
