package com.bookindexer.ingest.model;

import com.bookindexer.ingest.config.IndexerProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body posted to the scraper's {@code /crawl.json} endpoint.
 * <pre>
 * {
 *   "spider_name": "book",
 *   "start_requests": true,
 *   "crawl_args": { "books": "4", "project_id": "book-indexer", "topic_name": "scraper.catalog.v1" }
 * }
 * </pre>
 */
public record ScrapeRequest(
        @JsonProperty("spider_name") String spiderName,
        @JsonProperty("start_requests") boolean startRequests,
        @JsonProperty("crawl_args") CrawlArgs crawlArgs) {

    public static ScrapeRequest of(ScrapeJob job, IndexerProperties.Tasks tasks) {
        return new ScrapeRequest(job.kind().getSpiderName(), true, job.kind().crawlArgs(job.targetId(), tasks));
    }

    /** Spider-specific arguments; the variant is chosen by {@link JobKind}. */
    public interface CrawlArgs {
    }

    public record EntityCrawlArgs(
            @JsonProperty("books") String books,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("topic_name") String topicName) implements CrawlArgs {
    }

    public record OwnerCrawlArgs(
            @JsonProperty("users") String users,
            @JsonProperty("project_id") String projectId,
            @JsonProperty("topic_name") String topicName) implements CrawlArgs {
    }
}
