package com.vcc.traingateway.dto;

import com.vcc.traingateway.model.OAuthState;

import java.time.Instant;
import java.util.Set;

public record OAuthStatusResponse(
        String accountId,
        String accountName,
        OAuthState state,
        Long expiresAt,
        Long expiresInSeconds,
        Set<String> scopes,
        boolean tier,
        Instant lastRefreshAt,
        String lastError
) {}
