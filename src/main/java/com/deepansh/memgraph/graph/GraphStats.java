package com.deepansh.memgraph.graph;

import java.util.Map;

/**
 * @param byRelation   edge count per relation label, largest first
 * @param byEntityType edge count per "fromType -> toType" pair, top ten
 */
public record GraphStats(int totalRelationships, Map<String, Integer> byRelation, Map<String, Integer> byEntityType) {
}
