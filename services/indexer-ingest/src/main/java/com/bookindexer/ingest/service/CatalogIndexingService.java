package com.bookindexer.ingest.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.bookindexer.common.model.CatalogRecordDTO;
import com.bookindexer.ingest.client.CatalogApiClient;
import com.bookindexer.ingest.client.DownstreamClientException;
import com.bookindexer.ingest.config.IndexerProperties;
import tools.jackson.databind.JsonNode;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes catalog records the API does not have yet, one PUT per entity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogIndexingService {

    static final String DOMAIN = "catalog";

    private final RecordValidator recordValidator;
    private final ExistenceService existenceService;
    private final CatalogApiClient catalogApiClient;
    private final AuditPublisher auditPublisher;
    private final IndexerProperties properties;
    private final MeterRegistry meterRegistry;

    public IndexResult index(List<JsonNode> items) {
        Map<Long, CatalogRecordDTO> byEntity = new LinkedHashMap<>();
        for (CatalogRecordDTO record : recordValidator.validateAll(items, CatalogRecordDTO.class, DOMAIN)) {
            byEntity.putIfAbsent(record.getEntityId(), record);
        }
        if (byEntity.isEmpty()) {
            return IndexResult.empty();
        }

        Set<Long> existing = existenceService.findExistingEntities(byEntity.keySet());
        List<CatalogRecordDTO> written = new ArrayList<>();
        for (CatalogRecordDTO record : byEntity.values()) {
            if (existing.contains(record.getEntityId())) {
                continue;
            }
            try {
                catalogApiClient.createEntity(record);
                existenceService.markEntityExists(record.getEntityId());
                written.add(record);
            } catch (DownstreamClientException e) {
                log.warn("Dropping catalog record for entity_id {} ({}): {}",
                        record.getEntityId(), e.getStatusCode(), e.getMessage());
                Counter.builder("indexer.records.rejected")
                        .tag("domain", DOMAIN)
                        .tag("status", String.valueOf(e.getStatusCode()))
                        .register(meterRegistry)
                        .increment();
            }
        }

        increment("indexer.records.indexed", written.size());
        increment("indexer.records.skipped", existing.size());
        auditPublisher.sendBatch(properties.getTopics().getCatalogAudit(), written, CatalogRecordDTO::getEntityId);

        log.info("Catalog batch done: {} indexed, {} already present", written.size(), existing.size());
        return new IndexResult(written.size(), List.of());
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
