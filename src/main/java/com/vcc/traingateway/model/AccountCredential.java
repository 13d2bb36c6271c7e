package com.vcc.traingateway.model;

import com.vcc.traingateway.entity.AccountEntity;

/**
 * Secret material of an account, one variant per credential type.
 * Each variant writes exactly the columns its type requires and clears the others,
 * so an account row can only be persisted in a consistent shape.
 */
public sealed interface AccountCredential permits ApiKeyCredential, OAuthCredential {

    CredentialType type();

    /**
     * Encrypt this credential onto the row through the given sealer.
     */
    void writeTo(AccountEntity entity, SecretSealer sealer);

    @FunctionalInterface
    interface SecretSealer {
        String seal(SecretField field, String plaintext);
    }
}
