package com.bookindexer.ingest.cache;

import java.util.Optional;

import com.bookindexer.ingest.config.IndexerProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Size-bounded record of entities known to exist downstream.
 * <p>
 * Only positive answers are kept: an absent entity is expected to be created shortly
 * (often by the very scrape this service schedules), so a cached "absent" would go
 * stale immediately. {@code put(id, false)} is therefore ignored.
 */
public class EntityExistenceCache {

    private final Cache<Long, Boolean> knownEntities;

    public EntityExistenceCache(IndexerProperties.Cache settings) {
        this.knownEntities = Caffeine.newBuilder()
                .maximumSize(settings.getEntityMaxSize())
                .build();
    }

    public Optional<Boolean> get(long entityId) {
        return Optional.ofNullable(knownEntities.getIfPresent(entityId));
    }

    public void put(long entityId, boolean exists) {
        if (exists) {
            knownEntities.put(entityId, Boolean.TRUE);
        }
    }

    long estimatedSize() {
        knownEntities.cleanUp();
        return knownEntities.estimatedSize();
    }
}
