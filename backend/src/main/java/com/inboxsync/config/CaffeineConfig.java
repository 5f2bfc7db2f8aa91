package com.inboxsync.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.inboxsync.ingestion.config.GoogleApiProperties;
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

    public static final String ACCESS_TOKEN_CACHE = "accessTokenCache";

    @Bean
    public CacheManager caffeineCacheManager(GoogleApiProperties googleApiProperties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(ACCESS_TOKEN_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(Math.max(1L, googleApiProperties.getTokenTtlMinutes()), TimeUnit.MINUTES)
                .maximumSize(10)
                .build());
        return manager;
    }
}
