package com.boqregistry.config;

import com.boqregistry.classification.override.ClassificationOverrideService;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    /** Per-project override stores, keyed by projectId. */
    public static final String OVERRIDE_STORE_CACHE = ClassificationOverrideService.OVERRIDE_STORE_CACHE;

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(OVERRIDE_STORE_CACHE, Caffeine.newBuilder()
                .expireAfterAccess(60, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        return manager;
    }
}
