package com.deepansh.memgraph.dedup;

import java.util.Map;

/**
 * @param bySourceType entry counts keyed by items.json, daily_notes or other
 */
public record IndexStats(int totalEntries, Map<String, Integer> bySourceType, String location, long sizeBytes) {
}
