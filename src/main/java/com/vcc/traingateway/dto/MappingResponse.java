package com.vcc.traingateway.dto;

import com.vcc.traingateway.entity.TenantAccountMappingEntity;

import java.time.Instant;

public record MappingResponse(
        String tenantId,
        String accountId,
        int priority,
        Instant createdAt
) {
    public static MappingResponse fromEntity(TenantAccountMappingEntity entity) {
        return new MappingResponse(entity.getTenantId(), entity.getAccountId(),
                entity.getPriority(), entity.getCreatedAt());
    }
}
