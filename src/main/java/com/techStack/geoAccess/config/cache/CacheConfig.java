package com.techStack.geoAccess.config.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.GeoLookupResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Two-level cache for provider answers.
 *
 * L1: Caffeine, bounded and per-instance.
 * L2: Redis, shared across instances (see {@code GeoLookupCache}).
 */
@Configuration
public class CacheConfig {

    @Bean
    public Cache<String, GeoLookupResult> geoLookupLocalCache(GeoSecurityProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getLookup().getCacheMaxSize())
                .expireAfterWrite(properties.getLookup().getCacheTtl())
                .recordStats()
                .build();
    }
}
