package com.bookindexer.ingest.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.bookindexer.common.model.ActivityRecordDTO;
import com.bookindexer.ingest.client.CatalogApiClient;
import com.bookindexer.ingest.client.DownstreamClientException;
import com.bookindexer.ingest.config.IndexerProperties;
import tools.jackson.databind.JsonNode;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reconciles a batch of activity records against the catalog API.
 * <p>
 * Records are grouped per owner and only records the owner does not already have are written,
 * so a redelivered batch writes nothing. A rejected owner batch is dropped and the rest carry
 * on; a server error aborts the whole batch before anything is audited. Afterwards every
 * entity the batch refers to is considered for acquisition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityIndexingService {

    static final String DOMAIN = "activity";

    private final RecordValidator recordValidator;
    private final ExistenceService existenceService;
    private final CatalogApiClient catalogApiClient;
    private final EntityAcquisitionService entityAcquisitionService;
    private final AuditPublisher auditPublisher;
    private final IndexerProperties properties;
    private final MeterRegistry meterRegistry;

    public IndexResult index(List<JsonNode> items) {
        List<ActivityRecordDTO> records = recordValidator.validateAll(items, ActivityRecordDTO.class, DOMAIN);
        if (records.isEmpty()) {
            return IndexResult.empty();
        }

        int indexed = 0;
        int skipped = 0;
        List<ActivityRecordDTO> written = new ArrayList<>();

        for (Map.Entry<Long, List<ActivityRecordDTO>> entry : groupByOwner(records).entrySet()) {
            long ownerId = entry.getKey();
            Set<Long> alreadyIndexed = existenceService.entityIdsForOwner(ownerId);
            List<ActivityRecordDTO> fresh = entry.getValue().stream()
                    .filter(r -> !alreadyIndexed.contains(r.getEntityId()))
                    .toList();
            skipped += entry.getValue().size() - fresh.size();
            if (fresh.isEmpty()) {
                log.debug("All activity for owner_id {} already indexed", ownerId);
                continue;
            }

            try {
                indexed += catalogApiClient.createActivityBatch(fresh);
                written.addAll(fresh);
                existenceService.recordOwnerActivity(ownerId, fresh.stream().map(ActivityRecordDTO::getEntityId).toList());
            } catch (DownstreamClientException e) {
                log.warn("Dropping {} activity records for owner_id {} ({}): {}",
                        fresh.size(), ownerId, e.getStatusCode(), e.getMessage());
                Counter.builder("indexer.records.rejected")
                        .tag("domain", DOMAIN)
                        .tag("status", String.valueOf(e.getStatusCode()))
                        .register(meterRegistry)
                        .increment(fresh.size());
            }
        }

        increment("indexer.records.indexed", indexed);
        increment("indexer.records.skipped", skipped);
        auditPublisher.sendBatch(properties.getTopics().getActivityAudit(), written, ActivityRecordDTO::getOwnerId);

        List<Long> referenced = records.stream()
                .map(ActivityRecordDTO::getEntityId)
                .distinct()
                .toList();
        List<String> tasks = entityAcquisitionService.acquireMissing(referenced);

        log.info("Activity batch done: {} indexed, {} already present, {} tasks", indexed, skipped, tasks.size());
        return new IndexResult(indexed, tasks);
    }

    /**
     * Groups by owner in first-seen order. A repeated (owner, entity) pair keeps its first
     * occurrence.
     */
    private static Map<Long, List<ActivityRecordDTO>> groupByOwner(List<ActivityRecordDTO> records) {
        Map<Long, List<ActivityRecordDTO>> byOwner = new LinkedHashMap<>();
        Map<Long, Set<Long>> seen = new LinkedHashMap<>();
        for (ActivityRecordDTO record : records) {
            Set<Long> ownerSeen = seen.computeIfAbsent(record.getOwnerId(), k -> new HashSet<>());
            if (ownerSeen.add(record.getEntityId())) {
                byOwner.computeIfAbsent(record.getOwnerId(), k -> new ArrayList<>()).add(record);
            }
        }
        return byOwner;
    }

    private void increment(String name, int amount) {
        if (amount > 0) {
            Counter.builder(name)
                    .tag("domain", DOMAIN)
                    .register(meterRegistry)
                    .increment(amount);
        }
    }
}
