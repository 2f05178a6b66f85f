package com.residencepark.visitorparking.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caching configuration using Caffeine (in-process cache).
 *
 *   unitNumbers — sorted distinct unit numbers offered as a filter list.
 *                 Changes only when a visitor is registered or deleted;
 *                 UnitDirectoryService evicts it on both.
 *                 TTL: 30 minutes as a backstop. Single entry.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_UNIT_NUMBERS = "unitNumbers";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager — caches: '{}'", CACHE_UNIT_NUMBERS);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(buildCache(CACHE_UNIT_NUMBERS, 30, 1)));
        return manager;
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
