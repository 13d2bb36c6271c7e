package com.vcc.traingateway.model;

/**
 * Encrypted columns of an account. The AAD binds each ciphertext to its account and column,
 * so a value copied into another row or column fails to decrypt.
 */
public enum SecretField {
    API_KEY("api_key"),
    OAUTH_ACCESS("oauth_access"),
    OAUTH_REFRESH("oauth_refresh");

    private final String column;

    SecretField(String column) {
        this.column = column;
    }

    public String aad(String accountId) {
        return "account:" + accountId + ":" + column;
    }
}
