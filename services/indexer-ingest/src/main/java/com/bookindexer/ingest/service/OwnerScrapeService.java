package com.bookindexer.ingest.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.bookindexer.common.model.OwnerProfileDTO;
import com.bookindexer.ingest.config.IndexerProperties;
import com.bookindexer.ingest.model.EnqueueResult;
import com.bookindexer.ingest.model.ScrapeJob;
import tools.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Schedules an activity scrape for each owner profile. Nothing is written to the catalog API
 * here, so the result only carries tasks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OwnerScrapeService {

    static final String DOMAIN = "owners";

    private final RecordValidator recordValidator;
    private final TaskQueue taskQueue;
    private final AuditPublisher auditPublisher;
    private final IndexerProperties properties;

    public IndexResult schedule(List<JsonNode> items) {
        Map<Long, OwnerProfileDTO> byOwner = new LinkedHashMap<>();
        for (OwnerProfileDTO profile : recordValidator.validateAll(items, OwnerProfileDTO.class, DOMAIN)) {
            byOwner.putIfAbsent(profile.getOwnerId(), profile);
        }

        List<String> tasks = new ArrayList<>();
        List<OwnerProfileDTO> scheduled = new ArrayList<>();
        for (OwnerProfileDTO profile : byOwner.values()) {
            EnqueueResult result = taskQueue.enqueue(ScrapeJob.forOwner(profile.getOwnerId()));
            tasks.add(result.label());
            if (!result.duplicate()) {
                scheduled.add(profile);
            }
        }

        auditPublisher.sendBatch(properties.getTopics().getOwnerAudit(), scheduled, OwnerProfileDTO::getOwnerId);
        log.info("Owner batch done: {} scheduled, {} duplicates", scheduled.size(), tasks.size() - scheduled.size());
        return new IndexResult(0, tasks);
    }
}
