package com.deepansh.memgraph.dedup;

import com.deepansh.memgraph.model.Fact;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a dedup-gated fact write. Duplicates are expected outcomes, not errors.
 *
 * @param fact        the stored fact for ADDED, the already-stored match for NEAR_DUPLICATE
 * @param duplicateOf source of the earlier content for DUPLICATE, fact id for NEAR_DUPLICATE
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WriteOutcome(Status status, Fact fact, String fingerprint, String duplicateOf) {

    public enum Status {
        ADDED,
        DUPLICATE,
        NEAR_DUPLICATE
    }

    @JsonProperty("added")
    public boolean added() {
        return status == Status.ADDED;
    }
}
