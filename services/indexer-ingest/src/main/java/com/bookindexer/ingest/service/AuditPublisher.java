package com.bookindexer.ingest.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import com.bookindexer.ingest.config.IndexerProperties;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Mirrors confirmed records to the audit topics.
 * <p>
 * Publishing is best effort: the records are already durable downstream, so a failed or
 * timed-out send is logged and counted but never fails the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final IndexerProperties properties;
    private final MeterRegistry meterRegistry;

    public <T> void sendBatch(String topic, List<T> records, Function<T, ?> keyExtractor) {
        if (records.isEmpty()) {
            return;
        }
        if (!properties.getAudit().isEnabled()) {
            log.debug("Audit publishing disabled, not sending {} records to {}", records.size(), topic);
            return;
        }

        List<PendingSend> pending = new ArrayList<>(records.size());
        int failed = 0;
        for (T record : records) {
            String key = String.valueOf(keyExtractor.apply(record));
            try {
                String payload = objectMapper.writeValueAsString(record);
                pending.add(new PendingSend(key, kafkaTemplate.send(topic, key, payload)));
            } catch (JacksonException e) {
                log.error("Failed to serialize audit record {} for {}", key, topic, e);
                failed++;
            } catch (KafkaException | org.apache.kafka.common.KafkaException e) {
                // the producer is created lazily on the first send, so a bad bootstrap surfaces here
                log.error("Failed to send audit record {} to {}: {}", key, topic, e.getMessage());
                failed++;
            }
        }

        long deadline = System.nanoTime() + properties.getAudit().getPublishTimeout().toNanos();
        int published = 0;
        for (int i = 0; i < pending.size(); i++) {
            PendingSend send = pending.get(i);
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                send.future().get(remaining, TimeUnit.NANOSECONDS);
                published++;
            } catch (TimeoutException e) {
                log.error("Timed out publishing audit record {} to {}", send.key(), topic);
                failed++;
            } catch (ExecutionException e) {
                log.error("Failed to publish audit record {} to {}: {}", send.key(), topic, e.getCause().getMessage());
                failed++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for audit sends to {}", topic);
                failed += pending.size() - i;
                break;
            }
        }

        log.info("Published {} of {} audit records to {}", published, records.size(), topic);
        increment("indexer.audit.published", topic, published);
        increment("indexer.audit.failed", topic, failed);
    }

    private void increment(String name, String topic, int amount) {
        if (amount > 0) {
            Counter.builder(name)
                    .tag("topic", topic)
                    .register(meterRegistry)
                    .increment(amount);
        }
    }

    private record PendingSend(String key, CompletableFuture<SendResult<String, String>> future) {
    }
}
