package com.deepansh.memgraph.api;

import jakarta.validation.constraints.NotBlank;

/** Explicit edge to add. {@code since} defaults to today. */
public record RelationshipRequest(@NotBlank String from,
                                  @NotBlank String to,
                                  @NotBlank String relation,
                                  String since) {
}
