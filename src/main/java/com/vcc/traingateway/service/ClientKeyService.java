package com.vcc.traingateway.service;

import com.vcc.traingateway.crypto.KeyGeneratorService;
import com.vcc.traingateway.dto.ClientKeyView;
import com.vcc.traingateway.dto.CreateClientKeyRequest;
import com.vcc.traingateway.dto.CreateClientKeyResponse;
import com.vcc.traingateway.dto.RevokeClientKeyResponse;
import com.vcc.traingateway.entity.TenantClientKeyEntity;
import com.vcc.traingateway.exception.ResourceNotFoundException;
import com.vcc.traingateway.model.ClientKeyInfo;
import com.vcc.traingateway.repository.TenantClientKeyRepository;
import com.vcc.traingateway.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Credential store for tenant client keys.
 * Plaintext tokens exist only in the create response; lookups go by SHA-256 digest
 * through the Redis cache with a database fallback.
 */
@Service
public class ClientKeyService {
    private static final Logger log = LoggerFactory.getLogger(ClientKeyService.class);

    private final TenantClientKeyRepository clientKeyRepository;
    private final TenantRepository tenantRepository;
    private final KeyGeneratorService keyGeneratorService;
    private final CacheService cacheService;
    private final Clock clock;

    public ClientKeyService(TenantClientKeyRepository clientKeyRepository,
                            TenantRepository tenantRepository,
                            KeyGeneratorService keyGeneratorService,
                            CacheService cacheService,
                            Clock clock) {
        this.clientKeyRepository = clientKeyRepository;
        this.tenantRepository = tenantRepository;
        this.keyGeneratorService = keyGeneratorService;
        this.cacheService = cacheService;
        this.clock = clock;
    }

    /**
     * Issue a new client key for a tenant.
     * Returns the plaintext key ONLY once.
     */
    @Transactional
    public Mono<CreateClientKeyResponse> createClientKey(String tenantId, CreateClientKeyRequest request) {
        return tenantRepository.findById(tenantId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tenant", tenantId)))
                .flatMap(tenant -> {
                    KeyGeneratorService.GeneratedKey generated = keyGeneratorService.generateClientKey();

                    TenantClientKeyEntity entity = new TenantClientKeyEntity();
                    entity.setKeyId(UUID.randomUUID().toString());
                    entity.setTenantId(tenantId);
                    entity.setTokenHash(generated.hash());
                    entity.setKeyPrefix(generated.prefix());
                    entity.setKeySuffix(generated.suffix());
                    entity.setLabel(request.label());
                    entity.setCreatedBy(request.createdBy());
                    entity.setCreatedAt(clock.instant());

                    return clientKeyRepository.save(entity.markNew())
                            .map(saved -> {
                                log.info("Created client key {} for tenant {} (prefix={})",
                                        saved.getKeyId(), tenantId, saved.getKeyPrefix());
                                return CreateClientKeyResponse.create(
                                        saved.getKeyId(),
                                        saved.getTenantId(),
                                        ClientKeyView.preview(saved),
                                        generated.plaintext(),  // Only time we return this!
                                        saved.getLabel(),
                                        saved.getCreatedBy(),
                                        saved.getCreatedAt()
                                );
                            });
                });
    }

    /**
     * Resolve a presented token to its key. Empty for unknown or revoked tokens.
     * Bumps last-used asynchronously; that write never delays or fails the lookup.
     */
    public Mono<ClientKeyInfo> verifyClientKey(String token) {
        if (token == null || token.isBlank()) {
            return Mono.empty();
        }
        String tokenHash = keyGeneratorService.hash(token);
        return cacheService.getClientKey(tokenHash)
                .switchIfEmpty(Mono.defer(() -> lookupAndCache(tokenHash)))
                .doOnNext(info -> recordUse(info.keyId()));
    }

    private Mono<ClientKeyInfo> lookupAndCache(String tokenHash) {
        return clientKeyRepository.findActiveByTokenHash(tokenHash)
                .filter(entity -> entity.getRevokedAt() == null)
                .flatMap(entity -> {
                    ClientKeyInfo info = ClientKeyInfo.fromEntity(entity);
                    return cacheService.cacheClientKey(tokenHash, info).thenReturn(info);
                });
    }

    private void recordUse(String keyId) {
        Mono.defer(() -> clientKeyRepository.touchLastUsed(keyId))
                .subscribe(
                        rows -> log.trace("Recorded use of client key {}", keyId),
                        e -> log.warn("Failed to record last use of client key {}: {}", keyId, e.getMessage()));
    }

    /**
     * List client keys for a tenant (without hashes).
     */
    public Flux<ClientKeyView> listClientKeys(String tenantId) {
        return tenantRepository.findById(tenantId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tenant", tenantId)))
                .thenMany(clientKeyRepository.findByTenantId(tenantId))
                .map(ClientKeyView::fromEntity);
    }

    public Mono<ClientKeyView> renameClientKey(String tenantId, String keyId, String label) {
        return findOwned(tenantId, keyId)
                .flatMap(entity -> clientKeyRepository.updateLabel(keyId, label)
                        .then(Mono.fromCallable(() -> {
                            entity.setLabel(label);
                            log.info("Renamed client key {} (tenant={})", keyId, tenantId);
                            return ClientKeyView.fromEntity(entity);
                        })));
    }

    /**
     * Revoke a client key and mark it revoked in the cache before returning, so the very next
     * authentication with the token is rejected. Revoking twice is a no-op that still
     * re-marks the cache.
     * <p>
     * Not transactional: the single UPDATE commits on its own, and the cache marker must only be
     * written once no lookup can read the row as active any more.
     */
    public Mono<RevokeClientKeyResponse> revokeClientKey(String tenantId, String keyId, String revokedBy) {
        return findOwned(tenantId, keyId)
                .flatMap(entity -> clientKeyRepository.revoke(keyId, revokedBy)
                        .flatMap(rows -> cacheService.markClientKeyRevoked(entity.getTokenHash())
                                .map(deleted -> {
                                    boolean alreadyRevoked = rows == 0;
                                    Instant revokedAt = alreadyRevoked ? entity.getRevokedAt() : clock.instant();
                                    if (alreadyRevoked) {
                                        log.debug("Client key {} already revoked", keyId);
                                    } else {
                                        log.info("Revoked client key {} (tenant={}, prefix={}) by {}",
                                                keyId, tenantId, entity.getKeyPrefix(), revokedBy);
                                    }
                                    return new RevokeClientKeyResponse(
                                            keyId,
                                            tenantId,
                                            ClientKeyView.preview(entity),
                                            alreadyRevoked,
                                            revokedAt,
                                            true
                                    );
                                })));
    }

    private Mono<TenantClientKeyEntity> findOwned(String tenantId, String keyId) {
        return clientKeyRepository.findById(keyId)
                .filter(entity -> entity.getTenantId().equals(tenantId))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Client key", keyId)));
    }
}
