package com.vcc.traingateway.dto;

/**
 * Response DTO for account generation.
 * Contains the plaintext key which is ONLY returned once.
 */
public record GenerateAccountResponse(
        AccountView account,
        String apiKey,        // Plaintext key - only returned on creation!
        String warning
) {
    public static GenerateAccountResponse create(AccountView account, String plaintextKey) {
        return new GenerateAccountResponse(
                account,
                plaintextKey,
                "Store this API key securely. It will NOT be shown again."
        );
    }
}
