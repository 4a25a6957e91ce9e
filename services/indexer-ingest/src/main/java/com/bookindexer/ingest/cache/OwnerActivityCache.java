package com.bookindexer.ingest.cache;

import java.util.Optional;
import java.util.Set;

import com.bookindexer.ingest.config.IndexerProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Owner id to the entity ids the owner already has activity for.
 * <p>
 * Entries live for a fixed time after they were last written and are re-queried, not
 * refreshed, once expired. An empty set is a legitimate cached answer (the owner has
 * no activity yet).
 */
public class OwnerActivityCache {

    private final Cache<Long, Set<Long>> ownerToEntityIds;

    public OwnerActivityCache(IndexerProperties.Cache settings, Ticker ticker) {
        this.ownerToEntityIds = Caffeine.newBuilder()
                .expireAfterWrite(settings.getOwnerTtl())
                .maximumSize(settings.getOwnerMaxSize())
                .ticker(ticker)
                .build();
    }

    public Optional<Set<Long>> get(long ownerId) {
        return Optional.ofNullable(ownerToEntityIds.getIfPresent(ownerId));
    }

    public void put(long ownerId, Set<Long> entityIds) {
        ownerToEntityIds.put(ownerId, Set.copyOf(entityIds));
    }
}
