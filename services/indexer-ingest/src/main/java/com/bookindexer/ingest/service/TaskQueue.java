package com.bookindexer.ingest.service;

import com.bookindexer.ingest.model.EnqueueResult;
import com.bookindexer.ingest.model.ScrapeJob;

/**
 * Durable, deduplicating queue of scrape jobs.
 */
public interface TaskQueue {

    /**
     * Schedules {@code job} unless a job with the same identity already exists.
     *
     * @return the new job's handle, or {@link EnqueueResult#duplicate(String)}
     * @throws TaskQueueException if the queue cannot be written
     */
    EnqueueResult enqueue(ScrapeJob job);

    boolean isReady();
}
