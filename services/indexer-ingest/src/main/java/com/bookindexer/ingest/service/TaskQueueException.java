package com.bookindexer.ingest.service;

/**
 * The job queue could not be reached or refused a job for a reason other than a duplicate
 * identity. Fails the batch so the bus redelivers it.
 */
public class TaskQueueException extends RuntimeException {

    public TaskQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
