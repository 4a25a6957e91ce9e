package com.bookindexer.ingest.client;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.boot.restclient.RestTemplateBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.bookindexer.ingest.config.IndexerProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Concurrent fan-out over the catalog API's popularity endpoint.
 * <p>
 * One request per entity, issued in parallel on a bounded pool. Each attempt is classified
 * into a {@link PopularityOutcome}; 429/503/504 and connect failures are retried up to the
 * configured attempt ceiling with a fixed delay. Entities that never succeed are left out of
 * the result: a missing count only means "not scheduled this batch", never a failed batch.
 */
@Component
@Slf4j
public class PopularityClient {

    private static final List<HttpStatus> RETRYABLE_STATUSES = List.of(
            HttpStatus.TOO_MANY_REQUESTS, HttpStatus.SERVICE_UNAVAILABLE, HttpStatus.GATEWAY_TIMEOUT);

    private final RestTemplate restTemplate;
    private final ExecutorService executor;
    private final Retry retry;
    private final MeterRegistry meterRegistry;
    private final int limit;

    public PopularityClient(RestTemplateBuilder restTemplateBuilder, IndexerProperties properties,
            MeterRegistry meterRegistry) {
        IndexerProperties.Api api = properties.getApi();
        IndexerProperties.Popularity popularity = properties.getPopularity();

        this.restTemplate = restTemplateBuilder
                .rootUri(api.getBaseUrl())
                .connectTimeout(api.getConnectTimeout())
                .readTimeout(api.getReadTimeout())
                .build();
        this.executor = Executors.newFixedThreadPool(popularity.getParallelism(),
                new CustomizableThreadFactory("popularity-"));
        this.retry = Retry.of("popularity", RetryConfig.<PopularityOutcome>custom()
                .maxAttempts(popularity.getMaxAttempts())
                .waitDuration(popularity.getRetryDelay())
                .retryOnResult(PopularityOutcome::isRetryable)
                .build());
        this.meterRegistry = meterRegistry;
        this.limit = popularity.getThreshold();
    }

    /**
     * @param entityIds entities to look up; duplicates are queried once
     * @return entity id to observed owner count, for the entities that answered successfully
     */
    public Map<Long, Integer> getPopularity(Collection<Long> entityIds) {
        List<CompletableFuture<PopularityOutcome>> futures = new LinkedHashSet<>(entityIds).stream()
                .map(entityId -> CompletableFuture.supplyAsync(() -> lookupWithRetry(entityId), executor))
                .toList();

        // Wait for every lookup before acting on any of them
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        Map<Long, Integer> counts = new LinkedHashMap<>();
        for (CompletableFuture<PopularityOutcome> future : futures) {
            PopularityOutcome outcome = future.join();
            if (outcome.isSuccess()) {
                counts.put(outcome.entityId(), outcome.count());
            } else {
                log.warn("Omitting entity_id: {} from popularity results ({})", outcome.entityId(), outcome.kind());
                Counter.builder("indexer.popularity.omitted")
                        .tag("reason", outcome.kind().name())
                        .register(meterRegistry)
                        .increment();
            }
        }
        return counts;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private PopularityOutcome lookupWithRetry(long entityId) {
        try {
            return retry.executeSupplier(() -> lookupOnce(entityId));
        } catch (RuntimeException e) {
            log.warn("Uncaught exception getting popularity for entity_id: {}: {}", entityId, e.getMessage());
            return PopularityOutcome.nonRetryable(entityId);
        }
    }

    PopularityOutcome lookupOnce(long entityId) {
        try {
            PopularityResponse response = restTemplate.getForObject(
                    "/entities/{id}/popularity?limit={limit}", PopularityResponse.class, entityId, limit);
            if (response == null) {
                log.warn("Empty popularity response for entity_id: {}", entityId);
                return PopularityOutcome.nonRetryable(entityId);
            }
            return PopularityOutcome.success(entityId, response.count());

        } catch (HttpStatusCodeException e) {
            HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
            if (status != null && RETRYABLE_STATUSES.contains(status)) {
                log.warn("Retryable status {} for entity_id: {} popularity", e.getStatusCode().value(), entityId);
                return PopularityOutcome.retryable(entityId);
            }
            log.warn("Non retryable status {} for entity_id: {} popularity", e.getStatusCode().value(), entityId);
            return PopularityOutcome.nonRetryable(entityId);

        } catch (ResourceAccessException e) {
            if (isConnectFailure(e)) {
                log.warn("Could not connect for entity_id: {} popularity, retrying: {}", entityId, e.getMessage());
                return PopularityOutcome.retryable(entityId);
            }
            log.warn("Transport failure for entity_id: {} popularity: {}", entityId, e.getMessage());
            return PopularityOutcome.nonRetryable(entityId);

        } catch (RestClientException e) {
            log.warn("Unreadable popularity response for entity_id: {}: {}", entityId, e.getMessage());
            return PopularityOutcome.nonRetryable(entityId);
        }
    }

    private static boolean isConnectFailure(ResourceAccessException e) {
        Throwable cause = e.getCause();
        return cause instanceof ConnectException
                || cause instanceof NoRouteToHostException
                || cause instanceof UnknownHostException;
    }

    record PopularityResponse(@JsonProperty("count") int count) {
    }
}
