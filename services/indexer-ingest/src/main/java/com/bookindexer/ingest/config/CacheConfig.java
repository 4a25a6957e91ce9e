package com.bookindexer.ingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.bookindexer.ingest.cache.EntityExistenceCache;
import com.bookindexer.ingest.cache.OwnerActivityCache;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Existence caches are application-scoped singletons shared by all request threads.
 */
@Configuration
public class CacheConfig {

    @Bean
    public OwnerActivityCache ownerActivityCache(IndexerProperties properties) {
        return new OwnerActivityCache(properties.getCache(), Ticker.systemTicker());
    }

    @Bean
    public EntityExistenceCache entityExistenceCache(IndexerProperties properties) {
        return new EntityExistenceCache(properties.getCache());
    }
}
