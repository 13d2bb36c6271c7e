package com.vcc.traingateway.repository;

import com.vcc.traingateway.entity.TenantClientKeyEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TenantClientKeyRepository extends ReactiveCrudRepository<TenantClientKeyEntity, String> {

    @Query("SELECT * FROM tenant_client_keys WHERE token_hash = :tokenHash AND revoked_at IS NULL")
    Mono<TenantClientKeyEntity> findActiveByTokenHash(String tokenHash);

    @Query("SELECT * FROM tenant_client_keys WHERE tenant_id = :tenantId ORDER BY created_at DESC")
    Flux<TenantClientKeyEntity> findByTenantId(String tenantId);

    Mono<Boolean> existsByTokenHash(String tokenHash);

    @Modifying
    @Query("UPDATE tenant_client_keys SET revoked_at = NOW(3), revoked_by = :revokedBy "
            + "WHERE key_id = :keyId AND revoked_at IS NULL")
    Mono<Integer> revoke(String keyId, String revokedBy);

    @Modifying
    @Query("UPDATE tenant_client_keys SET label = :label WHERE key_id = :keyId")
    Mono<Integer> updateLabel(String keyId, String label);

    @Modifying
    @Query("UPDATE tenant_client_keys SET last_used_at = NOW(3) WHERE key_id = :keyId")
    Mono<Integer> touchLastUsed(String keyId);
}
