package com.bookindexer.ingest.client;

/**
 * Classified result of one popularity request. Exactly one of three kinds:
 * a count, a failure worth retrying, or a failure that is not.
 */
public record PopularityOutcome(Kind kind, long entityId, int count) {

    public enum Kind {
        SUCCESS, RETRYABLE, NON_RETRYABLE
    }

    public static PopularityOutcome success(long entityId, int count) {
        return new PopularityOutcome(Kind.SUCCESS, entityId, count);
    }

    public static PopularityOutcome retryable(long entityId) {
        return new PopularityOutcome(Kind.RETRYABLE, entityId, 0);
    }

    public static PopularityOutcome nonRetryable(long entityId) {
        return new PopularityOutcome(Kind.NON_RETRYABLE, entityId, 0);
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}
