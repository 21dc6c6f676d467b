package com.deepansh.memgraph.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One retrieval hit, from either path.
 *
 * {@code score} is the path's raw relevance in [0, 1]; {@code finalScore}
 * and {@code searchType} are set once the hit has been weighted for fusion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResult {

    private ResultType type;

    /** Entity key, note date, or the semantic service's own source label. */
    private String entity;

    private String content;

    private double score;

    private String timestamp;

    private String category;

    private String source;

    @JsonProperty("final_score")
    private Double finalScore;

    @JsonProperty("search_type")
    private SearchType searchType;
}
