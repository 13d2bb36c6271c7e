package com.vcc.traingateway.dto;

import com.vcc.traingateway.model.OAuthState;

import java.time.Instant;
import java.util.Set;

/**
 * Read-safe account view. Secrets only appear as a masked preview.
 */
public record AccountView(
        String accountId,
        String accountName,
        String credentialType,
        String provider,
        String region,
        String secretPreview,
        OAuthState oauthState,
        Long oauthExpiresAt,
        Set<String> oauthScopes,
        boolean oauthTier,
        String oauthLastError,
        Instant lastRefreshAt,
        boolean generated,
        boolean active,
        boolean revoked,
        Instant revokedAt,
        Instant createdAt,
        Instant updatedAt,
        Instant lastUsedAt
) {}
