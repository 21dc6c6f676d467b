package com.deepansh.memgraph.search;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResultType {
    ENTITY_FACT("entity_fact"),
    ENTITY_SUMMARY("entity_summary"),
    DAILY_NOTE("daily_note"),
    VECTOR_MATCH("vector_match");

    private final String value;

    ResultType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
