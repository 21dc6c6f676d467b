package com.deepansh.memgraph.search;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Retrieval path a fused result came from. */
public enum SearchType {
    VECTOR,
    KEYWORD;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
