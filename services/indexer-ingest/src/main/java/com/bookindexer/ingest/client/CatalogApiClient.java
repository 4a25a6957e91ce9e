package com.bookindexer.ingest.client;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.boot.restclient.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.bookindexer.common.model.ActivityRecordDTO;
import com.bookindexer.common.model.CatalogRecordDTO;
import com.bookindexer.ingest.config.IndexerProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.extern.slf4j.Slf4j;

/**
 * Thin client over the catalog API's write and existence endpoints.
 * <p>
 * Error policy:
 * <ul>
 * <li>writes: 4xx raises {@link DownstreamClientException}, 5xx or a transport failure
 * raises {@link DownstreamServerException}</li>
 * <li>existence queries: 4xx is a valid "nothing there yet" answer, 5xx or a transport
 * failure raises {@link DownstreamServerException}</li>
 * </ul>
 */
@Component
@Slf4j
public class CatalogApiClient {

    private final RestTemplate restTemplate;

    public CatalogApiClient(RestTemplateBuilder restTemplateBuilder, IndexerProperties properties) {
        IndexerProperties.Api api = properties.getApi();
        this.restTemplate = restTemplateBuilder
                .rootUri(api.getBaseUrl())
                .connectTimeout(api.getConnectTimeout())
                .readTimeout(api.getReadTimeout())
                .build();
    }

    public boolean isReady() {
        try {
            restTemplate.getForEntity("/health", String.class);
            return true;
        } catch (RestClientException e) {
            log.error("Could not reach catalog API for readiness check: {}", e.getMessage());
            return false;
        }
    }

    public void createEntity(CatalogRecordDTO record) {
        long entityId = record.getEntityId();
        String what = "entity_id " + entityId;
        try {
            restTemplate.put("/entities/{id}", record, entityId);
            log.info("Successfully wrote entity: {}", entityId);
        } catch (HttpClientErrorException e) {
            throw clientError(e, what);
        } catch (RestClientException e) {
            throw serverError(e, what);
        }
    }

    /**
     * Creates a batch of activity records. Returns how many the API reports as indexed.
     */
    public int createActivityBatch(List<ActivityRecordDTO> records) {
        String what = records.size() + " activity records";
        try {
            IndexedResponse response = restTemplate.postForObject(
                    "/activity/batch/create", new ActivityBatchRequest(records), IndexedResponse.class);
            int indexed = response != null ? response.indexed() : 0;
            log.info("Successfully indexed {} activity records", indexed);
            return indexed;
        } catch (HttpClientErrorException e) {
            throw clientError(e, what);
        } catch (RestClientException e) {
            throw serverError(e, what);
        }
    }

    /**
     * Returns the subset of {@code entityIds} the API already has.
     */
    public Set<Long> findExistingEntities(Collection<Long> entityIds) {
        if (entityIds.isEmpty()) {
            return Set.of();
        }
        try {
            EntityIdsPayload response = restTemplate.postForObject(
                    "/entities/batch/exists", new EntityIdsPayload(List.copyOf(entityIds)), EntityIdsPayload.class);
            return response != null ? response.asSet() : Set.of();
        } catch (HttpClientErrorException e) {
            log.info("Received {} from batch exists check, assuming none of {} exist",
                    e.getStatusCode().value(), entityIds);
            return Set.of();
        } catch (RestClientException e) {
            throw serverError(e, "entity_ids " + entityIds);
        }
    }

    /**
     * Returns the ids of all entities the owner already has activity for.
     */
    public Set<Long> findEntityIdsForOwner(long ownerId) {
        try {
            EntityIdsPayload response = restTemplate.getForObject(
                    "/owners/{id}/entity-ids", EntityIdsPayload.class, ownerId);
            return response != null ? response.asSet() : Set.of();
        } catch (HttpClientErrorException e) {
            // Business-valid answer: the owner has no activity indexed yet
            log.info("Received {} for owner_id: {}, assuming no activity indexed yet",
                    e.getStatusCode().value(), ownerId);
            return Set.of();
        } catch (RestClientException e) {
            throw serverError(e, "owner_id " + ownerId);
        }
    }

    private DownstreamClientException clientError(HttpClientErrorException e, String what) {
        log.error("Received {} from catalog API for {} with body: {}",
                e.getStatusCode().value(), what, e.getResponseBodyAsString());
        return new DownstreamClientException(
                "4xx response " + e.getStatusCode().value() + " for " + what, e.getStatusCode().value(), e);
    }

    private DownstreamServerException serverError(RestClientException e, String what) {
        if (e instanceof HttpServerErrorException hse) {
            log.error("Received {} from catalog API for {} with body: {}",
                    hse.getStatusCode().value(), what, hse.getResponseBodyAsString());
            return new DownstreamServerException(
                    "5xx response " + hse.getStatusCode().value() + " for " + what, e);
        }
        log.error("Catalog API call failed for {}: {}", what, e.getMessage());
        return new DownstreamServerException("Transport failure for " + what + ": " + e.getMessage(), e);
    }

    record ActivityBatchRequest(@JsonProperty("activity") List<ActivityRecordDTO> activity) {
    }

    record IndexedResponse(@JsonProperty("indexed") int indexed) {
    }

    record EntityIdsPayload(@JsonProperty("entity_ids") List<Long> entityIds) {

        Set<Long> asSet() {
            return entityIds != null ? new TreeSet<>(entityIds) : Set.of();
        }
    }
}
