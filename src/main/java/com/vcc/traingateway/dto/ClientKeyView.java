package com.vcc.traingateway.dto;

import com.vcc.traingateway.entity.TenantClientKeyEntity;

import java.time.Instant;

/**
 * Client key listing entry (without hash).
 */
public record ClientKeyView(
        String keyId,
        String tenantId,
        String keyPreview,
        String label,
        String createdBy,
        String status,
        Instant createdAt,
        Instant lastUsedAt,
        Instant revokedAt,
        String revokedBy
) {
    public static ClientKeyView fromEntity(TenantClientKeyEntity entity) {
        return new ClientKeyView(
                entity.getKeyId(),
                entity.getTenantId(),
                preview(entity),
                entity.getLabel(),
                entity.getCreatedBy(),
                entity.getRevokedAt() != null ? "revoked" : "active",
                entity.getCreatedAt(),
                entity.getLastUsedAt(),
                entity.getRevokedAt(),
                entity.getRevokedBy()
        );
    }

    public static String preview(TenantClientKeyEntity entity) {
        return entity.getKeyPrefix() + "****" + (entity.getKeySuffix() != null ? entity.getKeySuffix() : "");
    }
}
