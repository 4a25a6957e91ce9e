package com.bookindexer.ingest.client;

/**
 * The catalog API answered with a 5xx, or could not be reached at all.
 * Aborts the current batch so that the bus redelivers it.
 */
public class DownstreamServerException extends RuntimeException {

    public DownstreamServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
