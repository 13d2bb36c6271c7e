package com.vcc.traingateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.crypto.KeyGeneratorService;
import com.vcc.traingateway.entity.TenantClientKeyEntity;
import com.vcc.traingateway.model.ClientKeyInfo;
import com.vcc.traingateway.repository.TenantClientKeyRepository;
import com.vcc.traingateway.repository.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

/**
 * Revocation racing a cache-miss lookup, run against a real {@link CacheService} over an
 * in-memory Redis.
 */
@ExtendWith(MockitoExtension.class)
class ClientKeyRevocationTest {

    private static final String TENANT = "t_acme";
    private static final String TOKEN = "cnp_live_0123456789abcdef0123456789abcdef";

    @Mock
    private TenantClientKeyRepository clientKeyRepository;

    @Mock
    private TenantRepository tenantRepository;

    @Mock
    private ReactiveStringRedisTemplate redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOps;

    private final KeyGeneratorService keyGenerator = new KeyGeneratorService();
    private final Map<String, String> redis = new ConcurrentHashMap<>();
    private ClientKeyService clientKeyService;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        lenient().when(valueOps.multiGet(anyCollection())).thenAnswer(invocation -> {
            Collection<String> keys = invocation.getArgument(0);
            return Mono.fromCallable(() -> {
                List<String> values = new ArrayList<>();
                for (String key : keys) {
                    values.add(redis.get(key));
                }
                return values;
            });
        });
        lenient().when(valueOps.set(anyString(), anyString(), any(Duration.class))).thenAnswer(invocation -> {
            String key = invocation.getArgument(0);
            String value = invocation.getArgument(1);
            return Mono.fromCallable(() -> {
                redis.put(key, value);
                return true;
            });
        });
        lenient().when(valueOps.delete(anyString())).thenAnswer(invocation -> {
            String key = invocation.getArgument(0);
            return Mono.fromCallable(() -> redis.remove(key) != null);
        });
        lenient().when(clientKeyRepository.touchLastUsed(anyString())).thenReturn(Mono.just(1));

        CacheService cacheService = new CacheService(redisTemplate, new ObjectMapper(), new GwProperties());
        clientKeyService = new ClientKeyService(clientKeyRepository, tenantRepository, keyGenerator, cacheService,
                Clock.fixed(TestAccounts.NOW, ZoneOffset.UTC));
    }

    private TenantClientKeyEntity storedKey() {
        TenantClientKeyEntity entity = new TenantClientKeyEntity();
        entity.setKeyId("key_1");
        entity.setTenantId(TENANT);
        entity.setTokenHash(keyGenerator.hash(TOKEN));
        entity.setKeyPrefix(keyGenerator.displayPrefix(TOKEN));
        entity.setKeySuffix(keyGenerator.displaySuffix(TOKEN));
        entity.setCreatedAt(TestAccounts.NOW);
        return entity;
    }

    @Test
    void revokeDuringCacheMissLookup_nextVerificationFails() {
        TenantClientKeyEntity row = storedKey();
        TenantClientKeyEntity readBeforeRevoke = storedKey();
        AtomicInteger lookups = new AtomicInteger();
        when(clientKeyRepository.findById("key_1")).thenReturn(Mono.just(row));
        when(clientKeyRepository.revoke("key_1", "ops")).thenAnswer(invocation -> Mono.fromCallable(() -> {
            row.setRevokedAt(TestAccounts.NOW);
            return 1;
        }));
        when(clientKeyRepository.findActiveByTokenHash(keyGenerator.hash(TOKEN)))
                .thenAnswer(invocation -> Mono.fromCallable(() -> {
                    if (lookups.getAndIncrement() == 0) {
                        // the row was read as active; the revocation completes before the entry is cached
                        clientKeyService.revokeClientKey(TENANT, "key_1", "ops").block();
                        return readBeforeRevoke;
                    }
                    return row;
                }));

        StepVerifier.create(clientKeyService.verifyClientKey(TOKEN))
                .expectNext(new ClientKeyInfo("key_1", TENANT))
                .verifyComplete();
        assertTrue(redis.containsKey("gw:clientkey:" + keyGenerator.hash(TOKEN)));

        StepVerifier.create(clientKeyService.verifyClientKey(TOKEN))
                .verifyComplete();
    }

    @Test
    void revokeAfterCaching_nextVerificationFails() {
        TenantClientKeyEntity row = storedKey();
        when(clientKeyRepository.findById("key_1")).thenReturn(Mono.just(row));
        when(clientKeyRepository.revoke("key_1", "ops")).thenAnswer(invocation -> Mono.fromCallable(() -> {
            row.setRevokedAt(TestAccounts.NOW);
            return 1;
        }));
        when(clientKeyRepository.findActiveByTokenHash(keyGenerator.hash(TOKEN))).thenReturn(Mono.just(row));

        StepVerifier.create(clientKeyService.verifyClientKey(TOKEN))
                .expectNext(new ClientKeyInfo("key_1", TENANT))
                .verifyComplete();

        StepVerifier.create(clientKeyService.revokeClientKey(TENANT, "key_1", "ops"))
                .expectNextCount(1)
                .verifyComplete();

        StepVerifier.create(clientKeyService.verifyClientKey(TOKEN))
                .verifyComplete();
    }
}
