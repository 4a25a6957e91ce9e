package com.bookindexer.ingest.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.bookindexer.ingest.client.PopularityClient;
import com.bookindexer.ingest.config.IndexerProperties;
import com.bookindexer.ingest.model.ScrapeJob;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Schedules scrapes for entities that enough owners have engaged with but that the catalog
 * does not have yet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityAcquisitionService {

    private final PopularityClient popularityClient;
    private final ExistenceService existenceService;
    private final TaskQueue taskQueue;
    private final IndexerProperties properties;

    /**
     * Returns one task entry per scheduling decision, in the order of {@code entityIds}.
     * Entities whose popularity could not be read are never scheduled, whatever the threshold.
     */
    public List<String> acquireMissing(Collection<Long> entityIds) {
        Set<Long> candidates = new LinkedHashSet<>(entityIds);
        if (candidates.isEmpty()) {
            return List.of();
        }

        int threshold = properties.getPopularity().getThreshold();
        Map<Long, Integer> popularity = popularityClient.getPopularity(candidates);
        List<Long> popular = candidates.stream()
                .filter(id -> popularity.containsKey(id) && popularity.get(id) >= threshold)
                .toList();
        log.debug("{} of {} entities reach the popularity threshold {}", popular.size(), candidates.size(), threshold);
        if (popular.isEmpty()) {
            return List.of();
        }

        Set<Long> existing = existenceService.findExistingEntities(popular);
        List<String> tasks = new ArrayList<>();
        for (Long entityId : popular) {
            if (!existing.contains(entityId)) {
                tasks.add(taskQueue.enqueue(ScrapeJob.forEntity(entityId)).label());
            }
        }
        return tasks;
    }
}
