package com.deepansh.memgraph.graph;

import com.deepansh.memgraph.exception.InvalidRequestException;

import java.util.Locale;

/** Which edges a traversal follows from each visited entity. */
public enum Direction {
    OUT,
    IN,
    BOTH;

    public boolean followsOutbound() {
        return this != IN;
    }

    public boolean followsInbound() {
        return this != OUT;
    }

    public static Direction fromValue(String raw) {
        if (raw == null || raw.isBlank()) return BOTH;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Direction must be one of out, in, both; got '" + raw + "'");
        }
    }
}
