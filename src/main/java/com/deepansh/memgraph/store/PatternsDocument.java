package com.deepansh.memgraph.store;

import com.deepansh.memgraph.model.Relationship;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of patterns.json.
 * Behavioral sequences belong to another tool; they are carried through untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatternsDocument {

    private int version = 1;

    private List<Relationship> relationships = new ArrayList<>();

    @JsonProperty("behavioral_sequences")
    private List<JsonNode> behavioralSequences = new ArrayList<>();

    public static PatternsDocument empty() {
        return new PatternsDocument();
    }
}
