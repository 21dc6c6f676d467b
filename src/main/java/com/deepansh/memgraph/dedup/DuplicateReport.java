package com.deepansh.memgraph.dedup;

import java.util.List;

public record DuplicateReport(int totalProcessed, List<DuplicateEntry> duplicates, int indexSize) {
}
