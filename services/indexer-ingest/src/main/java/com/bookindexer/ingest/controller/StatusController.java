package com.bookindexer.ingest.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bookindexer.ingest.client.CatalogApiClient;
import com.bookindexer.ingest.service.TaskQueue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequiredArgsConstructor
@Slf4j
public class StatusController {

    private final CatalogApiClient catalogApiClient;
    private final TaskQueue taskQueue;

    @GetMapping("/")
    public String welcome() {
        return "Welcome to the book indexer";
    }

    /**
     * Healthy only when both the catalog API and the job queue answer.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        boolean apiReady = catalogApiClient.isReady();
        boolean queueReady = taskQueue.isReady();
        if (apiReady && queueReady) {
            return ResponseEntity.ok("Healthy");
        }
        log.warn("Health check failed: catalogApi={}, taskQueue={}", apiReady, queueReady);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Not Healthy");
    }
}
