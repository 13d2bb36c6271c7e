package com.vcc.traingateway.repository;

import com.vcc.traingateway.entity.TenantEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TenantRepository extends ReactiveCrudRepository<TenantEntity, String> {

    @Query("SELECT * FROM tenants ORDER BY tenant_id")
    Flux<TenantEntity> findAllOrdered();

    @Modifying
    @Query("UPDATE tenants SET default_account_id = NULL, updated_at = NOW(3) "
            + "WHERE default_account_id = :accountId")
    Mono<Integer> clearDefaultAccount(String accountId);
}
