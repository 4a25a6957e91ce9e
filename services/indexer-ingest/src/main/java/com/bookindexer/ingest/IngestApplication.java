package com.bookindexer.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Book Indexer ingest service - push-subscription driven indexing.
 *
 * Responsibilities:
 * - Accept catalog, activity and owner-profile batches pushed by the message bus
 * - Validate items and drop the ones already known (caches + downstream existence checks)
 * - Write the unseen records to the catalog API
 * - Mirror confirmed writes to the audit topics (Kafka)
 * - Schedule scrape jobs for popular books that are not indexed yet (durable job queue)
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class IngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestApplication.class, args);
    }
}
