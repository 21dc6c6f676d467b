package com.deepansh.memgraph.graph;

/** Outcome of a detection scan merged into the persisted edge set. */
public record MergeResult(int detected, int added, int total) {
}
