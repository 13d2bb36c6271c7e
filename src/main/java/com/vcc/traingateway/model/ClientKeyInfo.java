package com.vcc.traingateway.model;

import com.vcc.traingateway.entity.TenantClientKeyEntity;

/**
 * Cached result of a client key lookup. Holds no token material.
 */
public record ClientKeyInfo(String keyId, String tenantId) {

    public static ClientKeyInfo fromEntity(TenantClientKeyEntity entity) {
        return new ClientKeyInfo(entity.getKeyId(), entity.getTenantId());
    }
}
