package com.bookindexer.common.kafka;

/**
 * Centralized Kafka topic names for the book indexer.
 */
public final class KafkaTopics {

    // Audit mirrors of newly indexed records
    public static final String CATALOG_AUDIT = "indexer.catalog.audit";
    public static final String ACTIVITY_AUDIT = "indexer.activity.audit";
    public static final String OWNER_AUDIT = "indexer.owners.audit";

    // Topics the scraper publishes its results to, consumed back through the push subscriptions
    public static final String SCRAPER_CATALOG = "scraper.catalog.v1";
    public static final String SCRAPER_ACTIVITY = "scraper.activity.v1";

    private KafkaTopics() {
        throw new UnsupportedOperationException("Utility class");
    }
}
