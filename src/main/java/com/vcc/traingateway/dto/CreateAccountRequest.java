package com.vcc.traingateway.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for importing an existing provider credential.
 */
public record CreateAccountRequest(
        @Size(max = 255, message = "Account ID must be at most 255 characters")
        @Pattern(regexp = "^[a-zA-Z0-9_.-]*$", message = "Account ID can only contain letters, numbers, dots, underscores, and hyphens")
        String accountId,

        @NotBlank(message = "Account name is required")
        @Size(max = 255, message = "Account name must be at most 255 characters")
        String accountName,

        @NotBlank(message = "Credential type is required")
        @Pattern(regexp = "^(api_key|oauth)$", message = "Credential type must be api_key or oauth")
        String credentialType,

        @Pattern(regexp = "^(anthropic|bedrock)?$", message = "Provider must be anthropic or bedrock")
        String provider,

        @Size(max = 32, message = "Region must be at most 32 characters")
        String region,

        String apiKey,

        @Valid
        OAuthTokensRequest oauth
) {
    @Override
    public String toString() {
        return "CreateAccountRequest[accountName=" + accountName + ", credentialType=" + credentialType
                + ", provider=" + provider + "]";
    }
}
