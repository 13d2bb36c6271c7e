package com.vcc.traingateway.model;

import com.vcc.traingateway.crypto.KeyGeneratorService;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.exception.InvalidCredentialException;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * OAuth token pair with its plaintext metadata.
 *
 * @param expiresAt epoch millis, may be null when the provider did not report one
 * @param tier      true for Max-tier subscriptions
 */
public record OAuthCredential(
        String accessToken,
        String refreshToken,
        Long expiresAt,
        Set<String> scopes,
        boolean tier
) implements AccountCredential {

    public OAuthCredential {
        if (accessToken == null || accessToken.isBlank()) {
            throw new InvalidCredentialException("oauth account requires an access token");
        }
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new InvalidCredentialException("oauth account requires a refresh token");
        }
        scopes = scopes == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(scopes));
    }

    @Override
    public CredentialType type() {
        return CredentialType.OAUTH;
    }

    @Override
    public void writeTo(AccountEntity entity, SecretSealer sealer) {
        entity.setCredentialType(CredentialType.OAUTH.dbValue());
        entity.setApiKeyEncrypted(null);
        entity.setOauthAccessTokenEncrypted(sealer.seal(SecretField.OAUTH_ACCESS, accessToken));
        entity.setOauthRefreshTokenEncrypted(sealer.seal(SecretField.OAUTH_REFRESH, refreshToken));
        entity.setSecretHint(KeyGeneratorService.secretHint(accessToken));
        entity.setOauthExpiresAt(expiresAt);
        entity.setOauthScopes(joinScopes(scopes));
        entity.setOauthIsMax(tier);
    }

    /**
     * Scopes are stored space separated, the same way the token endpoint reports them.
     */
    public static String joinScopes(Set<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return null;
        }
        return scopes.stream().sorted().collect(Collectors.joining(" "));
    }

    public static Set<String> parseScopes(String scopes) {
        if (scopes == null || scopes.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(scopes.trim().split("\\s+"))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public String toString() {
        return "OAuthCredential[accessToken=" + KeyGeneratorService.maskSecret(accessToken)
                + ", refreshToken=****, expiresAt=" + expiresAt
                + ", scopes=" + scopes + ", tier=" + tier + "]";
    }
}
