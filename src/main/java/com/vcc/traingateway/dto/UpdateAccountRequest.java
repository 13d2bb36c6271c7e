package com.vcc.traingateway.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update of an account. Null fields are left unchanged. Supplying a credential
 * replaces the secret material and may switch the credential type.
 */
public record UpdateAccountRequest(
        @Size(max = 255, message = "Account name must be at most 255 characters")
        String accountName,

        @Pattern(regexp = "^(anthropic|bedrock)?$", message = "Provider must be anthropic or bedrock")
        String provider,

        @Size(max = 32, message = "Region must be at most 32 characters")
        String region,

        Boolean active,

        @Pattern(regexp = "^(api_key|oauth)?$", message = "Credential type must be api_key or oauth")
        String credentialType,

        String apiKey,

        @Valid
        OAuthTokensRequest oauth
) {
    public boolean replacesCredential() {
        return credentialType != null || apiKey != null || oauth != null;
    }

    @Override
    public String toString() {
        return "UpdateAccountRequest[accountName=" + accountName + ", provider=" + provider
                + ", active=" + active + ", credentialType=" + credentialType + "]";
    }
}
