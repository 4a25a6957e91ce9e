package com.bookindexer.ingest.service;

import java.util.List;

/**
 * What one batch achieved: the number of records the catalog API confirmed, and one entry per
 * scheduling decision (a job handle, or {@code "duplicate"}).
 */
public record IndexResult(int indexed, List<String> tasks) {

    public IndexResult {
        tasks = List.copyOf(tasks);
    }

    public static IndexResult empty() {
        return new IndexResult(0, List.of());
    }
}
