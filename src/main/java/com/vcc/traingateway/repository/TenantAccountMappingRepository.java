package com.vcc.traingateway.repository;

import com.vcc.traingateway.entity.TenantAccountMappingEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TenantAccountMappingRepository extends ReactiveCrudRepository<TenantAccountMappingEntity, Long> {

    @Query("SELECT * FROM tenant_account_mappings WHERE tenant_id = :tenantId ORDER BY priority, account_id")
    Flux<TenantAccountMappingEntity> findByTenantId(String tenantId);

    Flux<TenantAccountMappingEntity> findByAccountId(String accountId);

    Mono<TenantAccountMappingEntity> findByTenantIdAndAccountId(String tenantId, String accountId);

    @Modifying
    @Query("DELETE FROM tenant_account_mappings WHERE tenant_id = :tenantId AND account_id = :accountId")
    Mono<Integer> deleteByTenantIdAndAccountId(String tenantId, String accountId);
}
