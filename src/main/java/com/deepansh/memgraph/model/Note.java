package com.deepansh.memgraph.model;

import java.util.Arrays;
import java.util.List;

/**
 * A daily note document. The date is the file stem, path is relative to the workspace.
 */
public record Note(String date, String path, String content) {

    /** Blank-line separated paragraphs, trimmed, empties dropped. */
    public List<String> paragraphs() {
        return Arrays.stream(content.split("\\R\\s*\\R"))
                .map(String::strip)
                .filter(p -> !p.isEmpty())
                .toList();
    }
}
