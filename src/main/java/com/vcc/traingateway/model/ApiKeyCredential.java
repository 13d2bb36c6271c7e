package com.vcc.traingateway.model;

import com.vcc.traingateway.crypto.KeyGeneratorService;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.exception.InvalidCredentialException;

public record ApiKeyCredential(String secret) implements AccountCredential {

    public ApiKeyCredential {
        if (secret == null || secret.isBlank()) {
            throw new InvalidCredentialException("api_key account requires an API key");
        }
    }

    @Override
    public CredentialType type() {
        return CredentialType.API_KEY;
    }

    @Override
    public void writeTo(AccountEntity entity, SecretSealer sealer) {
        entity.setCredentialType(CredentialType.API_KEY.dbValue());
        entity.setApiKeyEncrypted(sealer.seal(SecretField.API_KEY, secret));
        entity.setSecretHint(KeyGeneratorService.secretHint(secret));
        entity.setOauthAccessTokenEncrypted(null);
        entity.setOauthRefreshTokenEncrypted(null);
        entity.setOauthExpiresAt(null);
        entity.setOauthScopes(null);
        entity.setOauthIsMax(false);
    }

    @Override
    public String toString() {
        return "ApiKeyCredential[secret=" + KeyGeneratorService.maskSecret(secret) + "]";
    }
}
