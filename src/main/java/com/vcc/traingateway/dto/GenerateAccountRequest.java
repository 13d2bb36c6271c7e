package com.vcc.traingateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for minting a broker-generated API key account.
 */
public record GenerateAccountRequest(
        @NotBlank(message = "Account name is required")
        @Size(max = 255, message = "Account name must be at most 255 characters")
        String accountName,

        @Pattern(regexp = "^(anthropic|bedrock)?$", message = "Provider must be anthropic or bedrock")
        String provider,

        @Size(max = 32, message = "Region must be at most 32 characters")
        String region
) {}
