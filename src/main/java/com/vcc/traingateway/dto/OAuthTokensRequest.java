package com.vcc.traingateway.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * OAuth token set supplied on import or manual re-authentication.
 */
public record OAuthTokensRequest(
        @NotBlank(message = "Access token is required")
        String accessToken,

        @NotBlank(message = "Refresh token is required")
        String refreshToken,

        // epoch millis
        Long expiresAt,

        List<String> scopes,

        Boolean isMax
) {
    @Override
    public String toString() {
        return "OAuthTokensRequest[expiresAt=" + expiresAt + ", scopes=" + scopes + ", isMax=" + isMax + "]";
    }
}
