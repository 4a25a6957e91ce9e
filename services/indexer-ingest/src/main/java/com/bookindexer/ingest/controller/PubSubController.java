package com.bookindexer.ingest.controller;

import java.util.List;
import java.util.function.Function;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bookindexer.common.model.PubSubEnvelope;
import com.bookindexer.ingest.client.DownstreamServerException;
import com.bookindexer.ingest.controller.PubSubController.IndexResponse;
import com.bookindexer.ingest.service.ActivityIndexingService;
import com.bookindexer.ingest.service.CatalogIndexingService;
import com.bookindexer.ingest.service.EnvelopeUnpacker;
import com.bookindexer.ingest.service.IndexResult;
import com.bookindexer.ingest.service.OwnerScrapeService;
import com.bookindexer.ingest.service.TaskQueueException;
import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.JsonNode;

/**
 * Push endpoints for the message bus subscriptions.
 * <p>
 * A 200 acknowledges the message, including when its payload is permanently unusable or its
 * processing hit an unexpected error. A 500 asks the bus to redeliver; that only happens when the
 * catalog API or the job queue failed in a way a later attempt may not.
 */
@RestController
@RequestMapping("/pubsub")
@RequiredArgsConstructor
@Slf4j
public class PubSubController {

    private static final int UNPROCESSABLE = 422;

    private final EnvelopeUnpacker envelopeUnpacker;
    private final CatalogIndexingService catalogIndexingService;
    private final ActivityIndexingService activityIndexingService;
    private final OwnerScrapeService ownerScrapeService;

    @PostMapping("/catalog/handle")
    public ResponseEntity<IndexResponse> handleCatalog(@Valid @RequestBody PubSubEnvelope envelope) {
        return handle("catalog", envelope, catalogIndexingService::index);
    }

    @PostMapping("/activity/handle")
    public ResponseEntity<IndexResponse> handleActivity(@Valid @RequestBody PubSubEnvelope envelope) {
        return handle("activity", envelope, activityIndexingService::index);
    }

    @PostMapping("/owners/handle")
    public ResponseEntity<IndexResponse> handleOwners(@Valid @RequestBody PubSubEnvelope envelope) {
        return handle("owners", envelope, ownerScrapeService::schedule);
    }

    private ResponseEntity<IndexResponse> handle(String domain, PubSubEnvelope envelope,
            Function<List<JsonNode>, IndexResult> processor) {
        String messageId = envelope.getMessage().getMessageId();
        log.info("Received {} message {} from {}", domain, messageId, envelope.getSubscription());

        try {
            List<JsonNode> items = envelopeUnpacker.unpack(envelope);
            IndexResult result = items.isEmpty() ? IndexResult.empty() : processor.apply(items);
            return ResponseEntity.ok(IndexResponse.builder()
                    .indexed(result.indexed())
                    .tasks(result.tasks())
                    .build());

        } catch (DownstreamServerException | TaskQueueException e) {
            log.error("Dependency failure processing {} message {}: {}", domain, messageId, e.getMessage());
            return failure(e.getMessage());
        } catch (Exception e) {
            log.error("Uncaught exception processing {} message {}, acknowledging", domain, messageId, e);
            return ResponseEntity.ok(IndexResponse.builder()
                    .indexed(0)
                    .tasks(List.of())
                    .build());
        }
    }

    @ExceptionHandler({ MethodArgumentNotValidException.class, BindException.class })
    public ResponseEntity<IndexResponse> handleValidationExceptions(BindException ex) {
        String message = "Invalid envelope";
        if (ex.getBindingResult().hasFieldErrors()) {
            var fe = ex.getBindingResult().getFieldErrors().get(0);
            message = fe.getField() + ": " + fe.getDefaultMessage();
        }
        log.warn("Rejected envelope: {}", message);
        return ResponseEntity.status(UNPROCESSABLE).body(IndexResponse.builder()
                .error(message)
                .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<IndexResponse> handleUnreadableJson(HttpMessageNotReadableException ex) {
        log.warn("Rejected unreadable envelope: {}", ex.getMessage());
        return ResponseEntity.status(UNPROCESSABLE).body(IndexResponse.builder()
                .error("Malformed JSON")
                .build());
    }

    private static ResponseEntity<IndexResponse> failure(String message) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(IndexResponse.builder()
                .error(message)
                .build());
    }

    @lombok.Data
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class IndexResponse {
        private Integer indexed;
        private List<String> tasks;
        private String error;
    }
}
