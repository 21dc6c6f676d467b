package com.deepansh.memgraph.salience;

/**
 * Store-wide salience figures. Averages and the maximum only cover facts
 * that already carry lastAccessed and accessCount.
 */
public record SalienceStats(
        int totalFacts,
        int factsWithSalience,
        double averageAccessCount,
        double averageScore,
        double maxScore,
        int highSalienceFacts,
        int lowSalienceFacts) {
}
