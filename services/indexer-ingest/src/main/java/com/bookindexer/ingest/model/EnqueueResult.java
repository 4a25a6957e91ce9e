package com.bookindexer.ingest.model;

/**
 * Outcome of submitting a scrape job: either a handle for the newly scheduled job, or a
 * note that an identical job already exists. A duplicate is a normal result, not an error.
 */
public record EnqueueResult(String jobName, String handle, boolean duplicate) {

    public static final String DUPLICATE = "duplicate";

    public static EnqueueResult scheduled(String jobName, String handle) {
        return new EnqueueResult(jobName, handle, false);
    }

    public static EnqueueResult duplicate(String jobName) {
        return new EnqueueResult(jobName, null, true);
    }

    /** What the acknowledgement reports for this job. */
    public String label() {
        return duplicate ? DUPLICATE : handle;
    }
}
