package com.bookindexer.ingest.model;

/**
 * A request to acquire content for one entity or one owner. Its identity is derived from
 * the kind and the target id only, so two requests for the same target are the same job.
 */
public record ScrapeJob(JobKind kind, long targetId) {

    public static ScrapeJob forEntity(long entityId) {
        return new ScrapeJob(JobKind.ENTITY, entityId);
    }

    public static ScrapeJob forOwner(long ownerId) {
        return new ScrapeJob(JobKind.OWNER, ownerId);
    }

    public String jobName() {
        return kind.jobName(targetId);
    }
}
