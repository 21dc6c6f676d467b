package com.deepansh.memgraph.api;

import jakarta.validation.constraints.NotBlank;

public record RegisterContentRequest(@NotBlank String text, @NotBlank String source) {
}
