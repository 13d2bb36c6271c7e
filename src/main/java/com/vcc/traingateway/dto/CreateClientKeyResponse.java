package com.vcc.traingateway.dto;

import java.time.Instant;

/**
 * Response DTO for client key creation.
 * Contains the plaintext token which is ONLY returned once.
 */
public record CreateClientKeyResponse(
        String keyId,
        String tenantId,
        String keyPreview,
        String apiKey,        // Plaintext token - only returned on creation!
        String label,
        String createdBy,
        Instant createdAt,
        String warning
) {
    public static CreateClientKeyResponse create(
            String keyId,
            String tenantId,
            String keyPreview,
            String plaintextKey,
            String label,
            String createdBy,
            Instant createdAt
    ) {
        return new CreateClientKeyResponse(
                keyId,
                tenantId,
                keyPreview,
                plaintextKey,
                label,
                createdBy,
                createdAt,
                "Store this API key securely. It will NOT be shown again."
        );
    }
}
