package com.deepansh.memgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** First-seen metadata for a content fingerprint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexEntry(String firstSeen, String source, String normalized) {
}
