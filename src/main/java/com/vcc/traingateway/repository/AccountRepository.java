package com.vcc.traingateway.repository;

import com.vcc.traingateway.entity.AccountEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface AccountRepository extends ReactiveCrudRepository<AccountEntity, String> {

    Mono<AccountEntity> findByAccountName(String accountName);

    Mono<Boolean> existsByAccountName(String accountName);

    @Query("SELECT * FROM accounts ORDER BY created_at DESC")
    Flux<AccountEntity> findAllNewestFirst();

    /**
     * Atomically install a refreshed token set. Guarded by the expiry the caller read before
     * refreshing: 0 rows means another writer rotated the tokens first (or the grant was
     * marked invalid) and the caller must re-read instead of overwriting.
     */
    @Modifying
    @Query("UPDATE accounts SET oauth_access_token_encrypted = :accessToken, "
            + "oauth_refresh_token_encrypted = :refreshToken, secret_hint = :secretHint, oauth_expires_at = :expiresAt, "
            + "oauth_scopes = :scopes, oauth_is_max = :isMax, oauth_status = 'ok', oauth_last_error = NULL, "
            + "last_refresh_at = NOW(3), updated_at = NOW(3) "
            + "WHERE account_id = :accountId AND oauth_status <> 'invalid_grant' "
            + "AND oauth_expires_at <=> :previousExpiresAt")
    Mono<Integer> applyOAuthRefresh(String accountId, String accessToken, String refreshToken, String secretHint,
                                    Long expiresAt, String scopes, boolean isMax, Long previousExpiresAt);

    /**
     * Mark the grant dead, guarded the same way as {@link #applyOAuthRefresh}: if another writer
     * already rotated the tokens, the rejection was for a stale refresh token and is ignored.
     */
    @Modifying
    @Query("UPDATE accounts SET oauth_status = 'invalid_grant', oauth_last_error = :error, "
            + "updated_at = NOW(3) WHERE account_id = :accountId "
            + "AND oauth_expires_at <=> :previousExpiresAt")
    Mono<Integer> markInvalidGrant(String accountId, String error, Long previousExpiresAt);

    /**
     * Write account metadata only. Secret and OAuth columns are left to the writers that own them,
     * and a revoked row stays inactive.
     */
    @Modifying
    @Query("UPDATE accounts SET account_name = :accountName, provider = :provider, region = :region, "
            + "is_active = (:active AND revoked_at IS NULL), updated_at = NOW(3) "
            + "WHERE account_id = :accountId")
    Mono<Integer> updateMetadata(String accountId, String accountName, String provider, String region,
                                 boolean active);

    /**
     * Replace the secret material of an account. Guarded on the credential type and expiry the caller
     * read, like {@link #applyOAuthRefresh}: 0 rows means a refresh or another replacement committed
     * in between.
     */
    @Modifying
    @Query("UPDATE accounts SET credential_type = :credentialType, api_key_encrypted = :apiKey, "
            + "oauth_access_token_encrypted = :accessToken, oauth_refresh_token_encrypted = :refreshToken, "
            + "secret_hint = :secretHint, oauth_expires_at = :expiresAt, oauth_scopes = :scopes, "
            + "oauth_is_max = :isMax, oauth_status = 'ok', oauth_last_error = NULL, "
            + "last_refresh_at = COALESCE(:lastRefreshAt, last_refresh_at), updated_at = NOW(3) "
            + "WHERE account_id = :accountId AND credential_type = :previousType "
            + "AND oauth_expires_at <=> :previousExpiresAt")
    Mono<Integer> replaceCredential(String accountId, String credentialType, String apiKey, String accessToken,
                                    String refreshToken, String secretHint, Long expiresAt, String scopes,
                                    boolean isMax, Instant lastRefreshAt, String previousType,
                                    Long previousExpiresAt);

    @Modifying
    @Query("UPDATE accounts SET last_used_at = NOW(3) WHERE account_id = :accountId")
    Mono<Integer> touchLastUsed(String accountId);

    @Modifying
    @Query("UPDATE accounts SET is_active = FALSE, revoked_at = NOW(3), updated_at = NOW(3) "
            + "WHERE account_id = :accountId AND revoked_at IS NULL")
    Mono<Integer> revoke(String accountId);

    /**
     * OAuth accounts due for refresh: not revoked, not dead, expiring before the deadline.
     */
    @Query("SELECT * FROM accounts WHERE credential_type = 'oauth' AND is_active = TRUE "
            + "AND revoked_at IS NULL AND oauth_status = 'ok' "
            + "AND (oauth_expires_at IS NULL OR oauth_expires_at <= :deadline)")
    Flux<AccountEntity> findOAuthDueBefore(long deadline);
}
