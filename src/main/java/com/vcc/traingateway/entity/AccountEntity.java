package com.vcc.traingateway.entity;

import com.vcc.traingateway.model.CredentialType;
import com.vcc.traingateway.model.Provider;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Provider credential row. Secret columns hold AES-GCM envelopes, never plaintext.
 */
@Table("accounts")
public class AccountEntity implements Persistable<String> {

    public static final String OAUTH_STATUS_OK = "ok";
    public static final String OAUTH_STATUS_INVALID_GRANT = "invalid_grant";

    @Id
    @Column("account_id")
    private String accountId;

    @Column("account_name")
    private String accountName;

    @Column("credential_type")
    private String credentialType;

    @Column("provider")
    private String provider;

    @Column("region")
    private String region;

    @Column("api_key_encrypted")
    private String apiKeyEncrypted;

    @Column("oauth_access_token_encrypted")
    private String oauthAccessTokenEncrypted;

    @Column("oauth_refresh_token_encrypted")
    private String oauthRefreshTokenEncrypted;

    // Last characters of the current secret, kept in clear for masked previews
    @Column("secret_hint")
    private String secretHint;

    @Column("oauth_expires_at")
    private Long oauthExpiresAt;

    @Column("oauth_scopes")
    private String oauthScopes;

    @Column("oauth_is_max")
    private boolean oauthIsMax;

    @Column("oauth_status")
    private String oauthStatus;

    @Column("oauth_last_error")
    private String oauthLastError;

    @Column("last_refresh_at")
    private Instant lastRefreshAt;

    @Column("is_generated")
    private boolean generated;

    @Column("key_hash")
    private String keyHash;

    @Column("is_active")
    private boolean active;

    @Column("revoked_at")
    private Instant revokedAt;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    @Column("last_used_at")
    private Instant lastUsedAt;

    @Transient
    private boolean newEntity;

    public AccountEntity() {
    }

    public CredentialType credentialTypeValue() {
        return CredentialType.fromDb(credentialType);
    }

    public Provider providerValue() {
        return Provider.fromDb(provider);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isInvalidGrant() {
        return OAUTH_STATUS_INVALID_GRANT.equals(oauthStatus);
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getAccountName() {
        return accountName;
    }

    public void setAccountName(String accountName) {
        this.accountName = accountName;
    }

    public String getCredentialType() {
        return credentialType;
    }

    public void setCredentialType(String credentialType) {
        this.credentialType = credentialType;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getApiKeyEncrypted() {
        return apiKeyEncrypted;
    }

    public void setApiKeyEncrypted(String apiKeyEncrypted) {
        this.apiKeyEncrypted = apiKeyEncrypted;
    }

    public String getOauthAccessTokenEncrypted() {
        return oauthAccessTokenEncrypted;
    }

    public void setOauthAccessTokenEncrypted(String oauthAccessTokenEncrypted) {
        this.oauthAccessTokenEncrypted = oauthAccessTokenEncrypted;
    }

    public String getOauthRefreshTokenEncrypted() {
        return oauthRefreshTokenEncrypted;
    }

    public void setOauthRefreshTokenEncrypted(String oauthRefreshTokenEncrypted) {
        this.oauthRefreshTokenEncrypted = oauthRefreshTokenEncrypted;
    }

    public String getSecretHint() {
        return secretHint;
    }

    public void setSecretHint(String secretHint) {
        this.secretHint = secretHint;
    }

    public Long getOauthExpiresAt() {
        return oauthExpiresAt;
    }

    public void setOauthExpiresAt(Long oauthExpiresAt) {
        this.oauthExpiresAt = oauthExpiresAt;
    }

    public String getOauthScopes() {
        return oauthScopes;
    }

    public void setOauthScopes(String oauthScopes) {
        this.oauthScopes = oauthScopes;
    }

    public boolean isOauthIsMax() {
        return oauthIsMax;
    }

    public void setOauthIsMax(boolean oauthIsMax) {
        this.oauthIsMax = oauthIsMax;
    }

    public String getOauthStatus() {
        return oauthStatus;
    }

    public void setOauthStatus(String oauthStatus) {
        this.oauthStatus = oauthStatus;
    }

    public String getOauthLastError() {
        return oauthLastError;
    }

    public void setOauthLastError(String oauthLastError) {
        this.oauthLastError = oauthLastError;
    }

    public Instant getLastRefreshAt() {
        return lastRefreshAt;
    }

    public void setLastRefreshAt(Instant lastRefreshAt) {
        this.lastRefreshAt = lastRefreshAt;
    }

    public boolean isGenerated() {
        return generated;
    }

    public void setGenerated(boolean generated) {
        this.generated = generated;
    }

    public String getKeyHash() {
        return keyHash;
    }

    public void setKeyHash(String keyHash) {
        this.keyHash = keyHash;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    public void setRevokedAt(Instant revokedAt) {
        this.revokedAt = revokedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public void setLastUsedAt(Instant lastUsedAt) {
        this.lastUsedAt = lastUsedAt;
    }

    @Override
    public String getId() {
        return accountId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    /**
     * Ids are assigned by the application, so inserts must be flagged explicitly.
     */
    public AccountEntity markNew() {
        this.newEntity = true;
        return this;
    }
}
