package com.vcc.traingateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.model.ClientKeyInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Redis cache for client key lookups (token hash to key id and tenant).
 * Reads degrade to a miss when Redis is unavailable; revocation failures propagate so a
 * revocation is never reported as done while a stale entry may still authenticate.
 * <p>
 * A revocation leaves a marker next to the entry. A lookup that read the database before the
 * revocation committed may still write the entry afterwards; reads ignore any entry while its
 * marker exists, and the marker outlives such an entry.
 */
@Service
public class CacheService {
    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration clientKeyTtl;
    private final Duration revokedMarkerTtl;

    public CacheService(ReactiveStringRedisTemplate redisTemplate,
                        ObjectMapper objectMapper,
                        GwProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;

        GwProperties.CacheConfig cacheConfig = properties.getCache();
        this.keyPrefix = cacheConfig.getKeyPrefix() != null ? cacheConfig.getKeyPrefix() : "gw:";
        this.clientKeyTtl = cacheConfig.getClientKeyTtl() != null
                ? cacheConfig.getClientKeyTtl()
                : Duration.ofMinutes(5);
        Duration markerTtl = cacheConfig.getRevokedMarkerTtl();
        this.revokedMarkerTtl = markerTtl != null && markerTtl.compareTo(clientKeyTtl) > 0
                ? markerTtl
                : clientKeyTtl.multipliedBy(2);
    }

    // ==================== Client Key Cache ====================

    /**
     * Get client key info from cache.
     *
     * @param tokenHash SHA-256 hash of the client token
     * @return ClientKeyInfo if cached and not revoked, empty Mono on miss or cache failure
     */
    public Mono<ClientKeyInfo> getClientKey(String tokenHash) {
        return redisTemplate.opsForValue().multiGet(List.of(cacheKey(tokenHash), revokedKey(tokenHash)))
                .flatMap(values -> {
                    // missing keys come back as null entries
                    if (values.size() > 1 && hasValue(values.get(1))) {
                        log.debug("Client key {} is revoked, ignoring cached entry", maskHash(tokenHash));
                        return Mono.empty();
                    }
                    if (values.isEmpty() || !hasValue(values.get(0))) {
                        return Mono.empty();
                    }
                    return Mono.just(values.get(0));
                })
                .flatMap(json -> deserialize(json, ClientKeyInfo.class))
                .doOnNext(info -> log.debug("Cache hit for client key: {}", maskHash(tokenHash)))
                .onErrorResume(e -> {
                    log.warn("Client key cache read failed, falling back to database: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Cache client key info.
     *
     * @return true if cached successfully
     */
    public Mono<Boolean> cacheClientKey(String tokenHash, ClientKeyInfo info) {
        return serialize(info)
                .flatMap(json -> redisTemplate.opsForValue().set(cacheKey(tokenHash), json, clientKeyTtl))
                .doOnSuccess(result -> log.debug("Cached client key: {}", maskHash(tokenHash)))
                .onErrorResume(e -> {
                    log.warn("Failed to cache client key: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Record a revocation: write the revoked marker, then drop the cached entry.
     * Call only after the revocation is committed to the database.
     *
     * @return true if a cached entry was deleted
     */
    public Mono<Boolean> markClientKeyRevoked(String tokenHash) {
        return redisTemplate.opsForValue().set(revokedKey(tokenHash), "1", revokedMarkerTtl)
                .then(Mono.defer(() -> redisTemplate.opsForValue().delete(cacheKey(tokenHash))))
                .doOnSuccess(deleted -> log.debug("Marked client key {} revoked (entryDeleted={})",
                        maskHash(tokenHash), deleted))
                .doOnError(e -> log.error("Failed to mark client key {} revoked in cache: {}",
                        maskHash(tokenHash), e.getMessage()));
    }

    // ==================== Helper Methods ====================

    private String cacheKey(String tokenHash) {
        return keyPrefix + "clientkey:" + tokenHash;
    }

    private String revokedKey(String tokenHash) {
        return keyPrefix + "clientkey:revoked:" + tokenHash;
    }

    private <T> Mono<T> deserialize(String json, Class<T> clazz) {
        try {
            return Mono.just(objectMapper.readValue(json, clazz));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cache value: {}", e.getMessage());
            return Mono.empty();
        }
    }

    private Mono<String> serialize(Object obj) {
        try {
            return Mono.just(objectMapper.writeValueAsString(obj));
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Failed to serialize for cache", e));
        }
    }

    private static boolean hasValue(String value) {
        return value != null && !value.isEmpty();
    }

    static String maskHash(String hash) {
        if (hash == null || hash.length() < 16) {
            return "****";
        }
        return hash.substring(0, 8) + "..." + hash.substring(hash.length() - 4);
    }
}
