package com.bookindexer.ingest.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.bookindexer.common.kafka.KafkaTopics;

import lombok.Data;

/**
 * Configuration properties for the indexer ingest service
 */
@Data
@ConfigurationProperties(prefix = "indexer")
public class IndexerProperties {

    private Api api = new Api();
    private Popularity popularity = new Popularity();
    private Cache cache = new Cache();
    private Topics topics = new Topics();
    private Audit audit = new Audit();
    private Tasks tasks = new Tasks();

    @Data
    public static class Api {
        private String baseUrl = "http://localhost:8999";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Popularity {
        private int threshold = 5;
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofMillis(500);
        private int parallelism = 16;
    }

    @Data
    public static class Cache {
        private Duration ownerTtl = Duration.ofMinutes(10);
        private long ownerMaxSize = 2000;
        private long entityMaxSize = 10000;
    }

    @Data
    public static class Topics {
        private String catalogAudit = KafkaTopics.CATALOG_AUDIT;
        private String activityAudit = KafkaTopics.ACTIVITY_AUDIT;
        private String ownerAudit = KafkaTopics.OWNER_AUDIT;
    }

    @Data
    public static class Audit {
        private boolean enabled = true;
        private Duration publishTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Tasks {
        private String queueName = "scrape-jobs";
        private String scraperBaseUrl = "http://localhost:9080";
        private String projectId = "book-indexer";
        private String catalogTopic = KafkaTopics.SCRAPER_CATALOG;
        private String activityTopic = KafkaTopics.SCRAPER_ACTIVITY;
        private Dispatcher dispatcher = new Dispatcher();

        @Data
        public static class Dispatcher {
            private boolean enabled = true;
            private int batchSize = 50;
            private int maxAttempts = 5;
            private Duration retention = Duration.ofDays(7);
        }
    }
}
