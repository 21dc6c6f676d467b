package com.deepansh.memgraph.dedup;

/** A later occurrence of content already indexed from originalSource. */
public record DuplicateEntry(String originalSource, String duplicateSource, String content, String fingerprint) {
}
