package com.techStack.geoAccess.service.geo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.internal.GeoLookupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Provider answers keyed by IP. Local Caffeine first, then Redis shared between instances.
 * Redis failures degrade to a miss; they never fail a lookup.
 */
@Service
public class GeoLookupCache {
    private static final Logger logger = LoggerFactory.getLogger(GeoLookupCache.class);

    private final Cache<String, GeoLookupResult> localCache;
    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final GeoSecurityProperties properties;

    public GeoLookupCache(@Qualifier("geoLookupLocalCache") Cache<String, GeoLookupResult> localCache,
                          @Qualifier("reactiveStringTemplate") ReactiveRedisTemplate<String, String> redisTemplate,
                          @Qualifier("redisObjectMapper") ObjectMapper objectMapper,
                          GeoSecurityProperties properties) {
        this.localCache = localCache;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public Mono<GeoLookupResult> get(String ipAddress) {
        GeoLookupResult local = localCache.getIfPresent(ipAddress);
        if (local != null) {
            return Mono.just(local);
        }

        return redisTemplate.opsForValue()
                .get(key(ipAddress))
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, GeoLookupResult.class));
                    } catch (JsonProcessingException e) {
                        logger.warn("Discarding unreadable cached lookup for {}: {}", ipAddress, e.getMessage());
                        return Mono.empty();
                    }
                })
                .doOnNext(result -> localCache.put(ipAddress, result))
                .onErrorResume(e -> {
                    logger.warn("Redis read failed for geo lookup {}: {}", ipAddress, e.getMessage());
                    return Mono.empty();
                });
    }

    public Mono<Void> put(String ipAddress, GeoLookupResult result) {
        localCache.put(ipAddress, result);
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            logger.warn("Geo lookup for {} not cached in Redis: {}", ipAddress, e.getMessage());
            return Mono.empty();
        }
        return redisTemplate.opsForValue()
                .set(key(ipAddress), json, properties.getLookup().getCacheTtl())
                .onErrorResume(e -> {
                    logger.warn("Redis write failed for geo lookup {}: {}", ipAddress, e.getMessage());
                    return Mono.just(false);
                })
                .then();
    }

    public Mono<Void> evict(String ipAddress) {
        localCache.invalidate(ipAddress);
        return redisTemplate.delete(key(ipAddress))
                .onErrorResume(e -> {
                    logger.warn("Redis evict failed for geo lookup {}: {}", ipAddress, e.getMessage());
                    return Mono.just(0L);
                })
                .then();
    }

    private static String key(String ipAddress) {
        return GeoSecurityConstants.GEO_LOOKUP_KEY_PREFIX + ipAddress;
    }
}
