package com.vcc.traingateway.service;

import com.vcc.traingateway.crypto.AesGcmCryptoService;
import com.vcc.traingateway.crypto.KeyGeneratorService;
import com.vcc.traingateway.dto.OAuthStatusResponse;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.exception.InvalidCredentialException;
import com.vcc.traingateway.exception.OAuthRefreshException;
import com.vcc.traingateway.exception.ResourceNotFoundException;
import com.vcc.traingateway.model.CredentialType;
import com.vcc.traingateway.model.OAuthCredential;
import com.vcc.traingateway.model.OAuthState;
import com.vcc.traingateway.model.SecretField;
import com.vcc.traingateway.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives the OAuth state machine of an account.
 * <p>
 * Refreshes are single-flight per account inside the process: concurrent callers share one
 * provider call and all observe its result. Across processes the write is a conditional
 * UPDATE on the expiry read before refreshing, so a caller that lost the race re-reads the
 * winner's tokens instead of overwriting them.
 */
@Service
public class OAuthLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(OAuthLifecycleManager.class);

    private final AccountRepository accountRepository;
    private final AccountService accountService;
    private final AesGcmCryptoService cryptoService;
    private final OAuthTokenClient tokenClient;
    private final OAuthStateEvaluator stateEvaluator;
    private final Clock clock;

    private final Map<String, Mono<AccountEntity>> inFlight = new ConcurrentHashMap<>();

    public OAuthLifecycleManager(AccountRepository accountRepository,
                                 AccountService accountService,
                                 AesGcmCryptoService cryptoService,
                                 OAuthTokenClient tokenClient,
                                 OAuthStateEvaluator stateEvaluator,
                                 Clock clock) {
        this.accountRepository = accountRepository;
        this.accountService = accountService;
        this.cryptoService = cryptoService;
        this.tokenClient = tokenClient;
        this.stateEvaluator = stateEvaluator;
        this.clock = clock;
    }

    public OAuthState stateOf(AccountEntity account) {
        return stateEvaluator.stateOf(account);
    }

    /**
     * Return the account ready for an outbound call, refreshing first when its token is
     * expiring or expired. Non-OAuth accounts pass through.
     */
    public Mono<AccountEntity> ensureFresh(AccountEntity account) {
        OAuthState state = stateOf(account);
        if (state == null || state == OAuthState.VALID) {
            return Mono.just(account);
        }
        if (state == OAuthState.INVALID_GRANT) {
            return Mono.error(OAuthRefreshException.invalidGrant(account.getAccountId(),
                    "Refresh token was rejected; account requires re-authentication"));
        }
        return refresh(account.getAccountId());
    }

    /**
     * Refresh if still due once the in-flight slot is held.
     */
    public Mono<AccountEntity> refresh(String accountId) {
        return singleFlight(accountId, false);
    }

    /**
     * Refresh even when the current token is still valid.
     */
    public Mono<AccountEntity> forceRefresh(String accountId) {
        return singleFlight(accountId, true);
    }

    public Mono<OAuthStatusResponse> status(String accountId) {
        return loadOAuthAccount(accountId).map(this::toStatus);
    }

    /**
     * Number of refreshes currently in progress in this process.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    // ==================== Refresh ====================

    private Mono<AccountEntity> singleFlight(String accountId, boolean force) {
        return Mono.defer(() -> inFlight.computeIfAbsent(accountId, id -> doRefresh(id, force)
                .doFinally(signal -> inFlight.remove(id))
                .cache()));
    }

    private Mono<AccountEntity> doRefresh(String accountId, boolean force) {
        return loadOAuthAccount(accountId)
                .flatMap(account -> {
                    if (account.isRevoked()) {
                        return Mono.error(new ResponseStatusException(HttpStatus.CONFLICT,
                                "Account is revoked: " + accountId));
                    }
                    OAuthState state = stateOf(account);
                    if (state == OAuthState.INVALID_GRANT) {
                        return Mono.error(OAuthRefreshException.invalidGrant(accountId,
                                "Refresh token was rejected; account requires re-authentication"));
                    }
                    if (state == OAuthState.VALID && !force) {
                        // Already refreshed by an earlier flight
                        return Mono.just(account);
                    }
                    return exchange(account);
                });
    }

    private Mono<AccountEntity> exchange(AccountEntity account) {
        String accountId = account.getAccountId();
        Long previousExpiresAt = account.getOauthExpiresAt();
        String refreshToken = accountService.getDecryptedSecret(account, SecretField.OAUTH_REFRESH);

        log.debug("Refreshing OAuth token for account {} (expiresAt={})", accountId, previousExpiresAt);
        // Provider failures and persistence of a success are handled on separate paths
        return tokenClient.refresh(refreshToken)
                .onErrorMap(OAuthRefreshException.class, e -> e.forAccount(accountId))
                .flux()
                .flatMap(
                        token -> persist(account, token, previousExpiresAt),
                        e -> onProviderFailure(account, previousExpiresAt, e),
                        Mono::empty)
                .next();
    }

    private Mono<AccountEntity> onProviderFailure(AccountEntity account, Long previousExpiresAt, Throwable error) {
        if (error instanceof OAuthRefreshException
                && ((OAuthRefreshException) error).getKind() == OAuthRefreshException.Kind.INVALID_GRANT) {
            return onInvalidGrant(account, previousExpiresAt, (OAuthRefreshException) error);
        }
        log.warn("Transient OAuth refresh failure for account {}: {}", account.getAccountId(), error.getMessage());
        return Mono.error(error);
    }

    private Mono<AccountEntity> persist(AccountEntity account, OAuthTokenClient.TokenResponse token,
                                        Long previousExpiresAt) {
        String accountId = account.getAccountId();
        long expiresAt = clock.millis() + token.expiresIn() * 1000L;
        boolean rotated = token.refreshToken() != null && !token.refreshToken().isBlank();

        String accessCiphertext = cryptoService.encrypt(token.accessToken(), SecretField.OAUTH_ACCESS.aad(accountId));
        // Provider convention: no refresh_token in the response means the old one stays valid
        String refreshCiphertext = rotated
                ? cryptoService.encrypt(token.refreshToken(), SecretField.OAUTH_REFRESH.aad(accountId))
                : account.getOauthRefreshTokenEncrypted();
        Set<String> scopes = token.scope() != null
                ? OAuthCredential.parseScopes(token.scope())
                : OAuthCredential.parseScopes(account.getOauthScopes());
        boolean tier = token.isMax() != null ? token.isMax() : account.isOauthIsMax();
        String hint = KeyGeneratorService.secretHint(token.accessToken());
        String joinedScopes = OAuthCredential.joinScopes(scopes);

        return accountRepository.applyOAuthRefresh(accountId, accessCiphertext, refreshCiphertext, hint,
                        expiresAt, joinedScopes, tier, previousExpiresAt)
                .flatMap(rows -> {
                    if (rows == 0) {
                        log.warn("OAuth refresh for account {} lost a concurrent update; using stored tokens",
                                accountId);
                        return reloadAfterConflict(accountId);
                    }
                    account.setOauthAccessTokenEncrypted(accessCiphertext);
                    account.setOauthRefreshTokenEncrypted(refreshCiphertext);
                    account.setSecretHint(hint);
                    account.setOauthExpiresAt(expiresAt);
                    account.setOauthScopes(joinedScopes);
                    account.setOauthIsMax(tier);
                    account.setOauthStatus(AccountEntity.OAUTH_STATUS_OK);
                    account.setOauthLastError(null);
                    account.setLastRefreshAt(clock.instant());
                    account.setUpdatedAt(clock.instant());
                    log.info("Refreshed OAuth token for account {} (expiresAt={}, refreshTokenRotated={})",
                            accountId, expiresAt, rotated);
                    return Mono.just(account);
                });
    }

    private Mono<AccountEntity> onInvalidGrant(AccountEntity account, Long previousExpiresAt,
                                               OAuthRefreshException error) {
        String accountId = account.getAccountId();
        return accountRepository.markInvalidGrant(accountId, truncate(error.getMessage()), previousExpiresAt)
                .flatMap(rows -> {
                    if (rows == 0) {
                        // Tokens were rotated elsewhere; the rejected refresh token was stale
                        log.warn("Ignoring invalid_grant for account {}: tokens were rotated concurrently",
                                accountId);
                        return reloadAfterConflict(accountId);
                    }
                    account.setOauthStatus(AccountEntity.OAUTH_STATUS_INVALID_GRANT);
                    account.setOauthLastError(truncate(error.getMessage()));
                    log.error("OAuth refresh token rejected for account {} ({}); re-authentication required",
                            accountId, account.getAccountName());
                    return Mono.error(error);
                });
    }

    private Mono<AccountEntity> reloadAfterConflict(String accountId) {
        return loadOAuthAccount(accountId)
                .flatMap(current -> {
                    OAuthState state = stateOf(current);
                    if (state == OAuthState.INVALID_GRANT) {
                        return Mono.error(OAuthRefreshException.invalidGrant(accountId,
                                "Refresh token was rejected; account requires re-authentication"));
                    }
                    if (state == OAuthState.EXPIRED) {
                        return Mono.error(OAuthRefreshException.transientFailure(accountId,
                                "Concurrent refresh left the token expired", null));
                    }
                    return Mono.just(current);
                });
    }

    // ==================== Helper Methods ====================

    private Mono<AccountEntity> loadOAuthAccount(String accountId) {
        return accountRepository.findById(accountId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Account", accountId)))
                .flatMap(account -> account.credentialTypeValue() == CredentialType.OAUTH
                        ? Mono.just(account)
                        : Mono.error(new InvalidCredentialException(
                                "Account " + accountId + " is not an oauth account")));
    }

    private OAuthStatusResponse toStatus(AccountEntity account) {
        Long expiresAt = account.getOauthExpiresAt();
        Long expiresIn = expiresAt != null ? Math.max(0L, (expiresAt - clock.millis()) / 1000L) : null;
        return new OAuthStatusResponse(
                account.getAccountId(),
                account.getAccountName(),
                stateOf(account),
                expiresAt,
                expiresIn,
                OAuthCredential.parseScopes(account.getOauthScopes()),
                account.isOauthIsMax(),
                account.getLastRefreshAt(),
                account.getOauthLastError()
        );
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > 500 ? message.substring(0, 500) : message;
    }
}
