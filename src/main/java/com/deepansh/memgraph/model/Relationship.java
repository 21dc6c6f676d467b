package com.deepansh.memgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Directed, labeled edge between two entity keys.
 * Identity is (from, to, relation); since and source are metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Relationship(String from, String to, String relation, String since, String source) {

    public static final String MENTIONS = "mentions";
    public static final String CO_MENTIONED = "co_mentioned";

    @JsonIgnore
    public String dedupKey() {
        return from + "#" + to + "#" + relation;
    }
}
