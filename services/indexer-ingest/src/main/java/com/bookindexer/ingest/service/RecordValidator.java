package com.bookindexer.ingest.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Binds raw items to DTOs and applies their constraints. Invalid items are dropped with a
 * warning; they never fail the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecordValidator {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final MeterRegistry meterRegistry;

    public <T> List<T> validateAll(List<JsonNode> items, Class<T> type, String domain) {
        List<T> valid = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            validate(item, type, domain).ifPresent(valid::add);
        }
        if (valid.size() < items.size()) {
            log.info("Dropped {} of {} {} records as invalid", items.size() - valid.size(), items.size(), domain);
        }
        return valid;
    }

    public <T> Optional<T> validate(JsonNode item, Class<T> type, String domain) {
        T record;
        try {
            record = objectMapper.treeToValue(item, type);
        } catch (JacksonException | IllegalArgumentException e) {
            log.warn("Unreadable {} record {}: {}", domain, item, e.getMessage());
            return invalid(domain);
        }
        if (record == null) {
            log.warn("Empty {} record, skipping", domain);
            return invalid(domain);
        }

        Set<ConstraintViolation<T>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            String reasons = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            log.warn("Invalid {} record {}: {}", domain, item, reasons);
            return invalid(domain);
        }
        return Optional.of(record);
    }

    private <T> Optional<T> invalid(String domain) {
        Counter.builder("indexer.records.invalid")
                .tag("domain", domain)
                .register(meterRegistry)
                .increment();
        return Optional.empty();
    }
}
