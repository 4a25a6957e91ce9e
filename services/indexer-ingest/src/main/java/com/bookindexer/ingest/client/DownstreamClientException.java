package com.bookindexer.ingest.client;

/**
 * The catalog API rejected a write with a 4xx. The affected item is dropped and the
 * rest of the batch carries on.
 */
public class DownstreamClientException extends RuntimeException {

    private final int statusCode;

    public DownstreamClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
