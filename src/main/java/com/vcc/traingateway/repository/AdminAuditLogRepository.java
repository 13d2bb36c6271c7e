package com.vcc.traingateway.repository;

import com.vcc.traingateway.entity.AdminAuditLogEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AdminAuditLogRepository extends ReactiveCrudRepository<AdminAuditLogEntity, Long> {

    @Query("SELECT * FROM admin_audit_log WHERE target_type = :targetType AND target_id = :targetId "
            + "ORDER BY created_at DESC")
    Flux<AdminAuditLogEntity> findByTarget(String targetType, String targetId);

    @Query("SELECT * FROM admin_audit_log ORDER BY created_at DESC LIMIT :limit")
    Flux<AdminAuditLogEntity> findRecent(int limit);
}
