package com.deepansh.memgraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FactStatus {
    ACTIVE,
    SUPERSEDED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Missing status on legacy records reads as active. */
    @JsonCreator
    public static FactStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) return ACTIVE;
        return "superseded".equalsIgnoreCase(raw.trim()) ? SUPERSEDED : ACTIVE;
    }
}
