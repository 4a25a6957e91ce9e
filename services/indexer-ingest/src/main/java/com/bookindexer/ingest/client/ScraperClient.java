package com.bookindexer.ingest.client;

import org.springframework.boot.restclient.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import com.bookindexer.ingest.config.IndexerProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Starts crawls on the scraper service. The payload is the JSON stored with the job.
 */
@Component
@Slf4j
public class ScraperClient {

    private final RestTemplate restTemplate;

    public ScraperClient(RestTemplateBuilder restTemplateBuilder, IndexerProperties properties) {
        this.restTemplate = restTemplateBuilder
                .rootUri(properties.getTasks().getScraperBaseUrl())
                .connectTimeout(properties.getApi().getConnectTimeout())
                .readTimeout(properties.getApi().getReadTimeout())
                .build();
    }

    /**
     * @throws org.springframework.web.client.RestClientException when the scraper rejects
     *         the crawl or cannot be reached
     */
    public void startCrawl(String payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        restTemplate.postForEntity("/crawl.json", new HttpEntity<>(payload, headers), String.class);
        log.debug("Scraper accepted crawl: {}", payload);
    }
}
