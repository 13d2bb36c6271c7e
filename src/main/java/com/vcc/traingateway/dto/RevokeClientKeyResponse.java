package com.vcc.traingateway.dto;

import java.time.Instant;

/**
 * Response DTO for client key revocation.
 */
public record RevokeClientKeyResponse(
        String keyId,
        String tenantId,
        String keyPreview,
        boolean alreadyRevoked,
        Instant revokedAt,
        boolean cacheInvalidated
) {}
