package com.deepansh.memgraph.search;

import com.deepansh.memgraph.exception.InvalidRequestException;

import java.util.Locale;

public enum SearchMode {
    HYBRID,
    KEYWORD,
    VECTOR;

    public static SearchMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) return HYBRID;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Search mode must be one of hybrid, keyword, vector; got '" + raw + "'");
        }
    }
}
