package com.deepansh.memgraph.dedup;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Candidate fact supplied by a writer. Timestamp defaults to today when absent.
 */
public record FactDraft(
        @NotBlank @Size(min = 3) String fact,
        @NotBlank String category,
        String type,
        String timestamp,
        String source) {
}
