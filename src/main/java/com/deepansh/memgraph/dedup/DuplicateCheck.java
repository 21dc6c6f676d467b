package com.deepansh.memgraph.dedup;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Result of looking a text up in the fingerprint index. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DuplicateCheck(@JsonProperty("isDuplicate") boolean isDuplicate,
                             String fingerprint,
                             String firstSeen,
                             String originalSource) {

    static DuplicateCheck unique(String fingerprint) {
        return new DuplicateCheck(false, fingerprint, null, null);
    }
}
