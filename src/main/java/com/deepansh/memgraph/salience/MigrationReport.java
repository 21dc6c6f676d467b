package com.deepansh.memgraph.salience;

import java.util.List;

/** Outcome of back-filling salience fields into every items.json. */
public record MigrationReport(int filesProcessed, int factsUpdated, List<String> errors) {
}
