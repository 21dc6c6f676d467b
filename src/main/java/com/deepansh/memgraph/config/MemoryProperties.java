package com.deepansh.memgraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strongly-typed configuration for the memory graph.
 * Bound from application.yml under the "memory" prefix and handed to every
 * component at construction; nothing looks paths up on its own.
 */
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    /** Root holding life/areas, memory/, patterns.json and the fingerprint index. */
    private String workspaceDir = ".";

    private SemanticSearch semanticSearch = new SemanticSearch();
    private Graph graph = new Graph();
    private Salience salience = new Salience();
    private Search search = new Search();
    private Dedup dedup = new Dedup();

    @Data
    public static class SemanticSearch {
        private boolean enabled = true;
        private String host = "localhost";
        private int port = 37777;
        private String path = "/search";
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 10000;

        public String getBaseUrl() {
            return "http://" + host + ":" + port;
        }
    }

    @Data
    public static class Graph {
        private int defaultDepth = 2;
    }

    @Data
    public static class Salience {
        private int decayWindowDays = 365;
        private double highThreshold = 1.0;
        private double lowThreshold = 0.1;
    }

    @Data
    public static class Search {
        private double vectorWeight = 0.6;
        private double keywordWeight = 0.4;
        private int defaultLimit = 10;
        private int snippetLength = 200;
        /** Semantic hits are cut to this many characters. */
        private int vectorContentLength = 300;
    }

    @Data
    public static class Dedup {
        /** Note paragraphs shorter than this are not fingerprinted. */
        private int minParagraphLength = 20;
        private double nearDuplicateThreshold = 0.8;
    }
}
