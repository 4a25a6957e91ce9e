package com.bookindexer.ingest.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.bookindexer.ingest.cache.EntityExistenceCache;
import com.bookindexer.ingest.cache.OwnerActivityCache;
import com.bookindexer.ingest.client.CatalogApiClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers "is this already indexed?" through the caches, falling back to the catalog API on a
 * miss. Server errors from the API propagate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExistenceService {

    private final CatalogApiClient catalogApiClient;
    private final OwnerActivityCache ownerActivityCache;
    private final EntityExistenceCache entityExistenceCache;

    public Set<Long> entityIdsForOwner(long ownerId) {
        Optional<Set<Long>> cached = ownerActivityCache.get(ownerId);
        if (cached.isPresent()) {
            log.debug("Owner cache hit for owner_id {}", ownerId);
            return cached.get();
        }
        Set<Long> entityIds = catalogApiClient.findEntityIdsForOwner(ownerId);
        ownerActivityCache.put(ownerId, entityIds);
        return entityIds;
    }

    /**
     * Adds freshly written entity ids to the owner's cached set. Nothing is cached when the
     * owner has no live entry, since a partial set would hide older activity.
     */
    public void recordOwnerActivity(long ownerId, Collection<Long> writtenEntityIds) {
        ownerActivityCache.get(ownerId).ifPresent(known -> {
            Set<Long> merged = new HashSet<>(known);
            merged.addAll(writtenEntityIds);
            ownerActivityCache.put(ownerId, merged);
        });
    }

    /**
     * Returns the subset of {@code entityIds} known to exist downstream.
     */
    public Set<Long> findExistingEntities(Collection<Long> entityIds) {
        Set<Long> existing = new LinkedHashSet<>();
        List<Long> unknown = new ArrayList<>();
        for (Long entityId : new LinkedHashSet<>(entityIds)) {
            if (entityExistenceCache.get(entityId).orElse(false)) {
                existing.add(entityId);
            } else {
                unknown.add(entityId);
            }
        }
        log.debug("Entity cache hits: {}, querying {} ids", existing.size(), unknown.size());

        Set<Long> found = catalogApiClient.findExistingEntities(unknown);
        found.forEach(this::markEntityExists);
        existing.addAll(found);
        return existing;
    }

    public void markEntityExists(long entityId) {
        entityExistenceCache.put(entityId, true);
    }
}
