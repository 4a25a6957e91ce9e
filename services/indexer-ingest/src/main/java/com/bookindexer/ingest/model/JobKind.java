package com.bookindexer.ingest.model;

import com.bookindexer.ingest.config.IndexerProperties;

/**
 * The kinds of scrape job the indexer schedules. Each kind fixes the job identity prefix,
 * the scraper spider to run and the shape of that spider's crawl arguments.
 */
public enum JobKind {

    ENTITY("entity-", "book") {
        @Override
        public ScrapeRequest.CrawlArgs crawlArgs(long targetId, IndexerProperties.Tasks tasks) {
            return new ScrapeRequest.EntityCrawlArgs(
                    String.valueOf(targetId), tasks.getProjectId(), tasks.getCatalogTopic());
        }
    },

    OWNER("owner-", "user_reviews") {
        @Override
        public ScrapeRequest.CrawlArgs crawlArgs(long targetId, IndexerProperties.Tasks tasks) {
            return new ScrapeRequest.OwnerCrawlArgs(
                    String.valueOf(targetId), tasks.getProjectId(), tasks.getActivityTopic());
        }
    };

    private final String identityPrefix;
    private final String spiderName;

    JobKind(String identityPrefix, String spiderName) {
        this.identityPrefix = identityPrefix;
        this.spiderName = spiderName;
    }

    public abstract ScrapeRequest.CrawlArgs crawlArgs(long targetId, IndexerProperties.Tasks tasks);

    public String jobName(long targetId) {
        return identityPrefix + targetId;
    }

    public String getSpiderName() {
        return spiderName;
    }
}
