package com.vcc.traingateway.service;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.crypto.AesGcmCryptoService;
import com.vcc.traingateway.crypto.KeyGeneratorService;
import com.vcc.traingateway.dto.AccountView;
import com.vcc.traingateway.dto.CreateAccountRequest;
import com.vcc.traingateway.dto.GenerateAccountRequest;
import com.vcc.traingateway.dto.GenerateAccountResponse;
import com.vcc.traingateway.dto.OAuthTokensRequest;
import com.vcc.traingateway.dto.UpdateAccountRequest;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.exception.CredentialCorruptionException;
import com.vcc.traingateway.exception.DuplicateResourceException;
import com.vcc.traingateway.exception.InvalidCredentialException;
import com.vcc.traingateway.exception.ResourceNotFoundException;
import com.vcc.traingateway.model.AccountCredential;
import com.vcc.traingateway.model.ApiKeyCredential;
import com.vcc.traingateway.model.CredentialType;
import com.vcc.traingateway.model.OAuthCredential;
import com.vcc.traingateway.model.Provider;
import com.vcc.traingateway.model.SecretField;
import com.vcc.traingateway.repository.AccountRepository;
import com.vcc.traingateway.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.UUID;

/**
 * Credential store for provider accounts.
 * <p>
 * Secrets are encrypted before they reach an entity and are only decrypted through
 * {@link #getDecryptedSecret}, which is reserved for outbound call construction.
 * Every write goes through an {@link AccountCredential} variant, so a row whose secrets
 * do not match its credential type is rejected before it can be saved.
 */
@Service
public class AccountService {
    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private static final String ACCOUNT_ID_PREFIX = "acc_";

    private final AccountRepository accountRepository;
    private final TenantRepository tenantRepository;
    private final AesGcmCryptoService cryptoService;
    private final KeyGeneratorService keyGeneratorService;
    private final OAuthStateEvaluator stateEvaluator;
    private final Clock clock;
    private final String defaultRegion;

    public AccountService(AccountRepository accountRepository,
                          TenantRepository tenantRepository,
                          AesGcmCryptoService cryptoService,
                          KeyGeneratorService keyGeneratorService,
                          OAuthStateEvaluator stateEvaluator,
                          Clock clock,
                          GwProperties properties) {
        this.accountRepository = accountRepository;
        this.tenantRepository = tenantRepository;
        this.cryptoService = cryptoService;
        this.keyGeneratorService = keyGeneratorService;
        this.stateEvaluator = stateEvaluator;
        this.clock = clock;
        this.defaultRegion = properties.getBedrockDefaultRegion();
    }

    // ==================== Create ====================

    /**
     * Import an existing provider credential.
     */
    @Transactional
    public Mono<AccountView> createAccount(CreateAccountRequest request) {
        return Mono.fromCallable(() -> toCredential(
                        CredentialType.fromDb(request.credentialType()), request.apiKey(), request.oauth()))
                .flatMap(credential -> {
                    String accountId = request.accountId() != null && !request.accountId().isBlank()
                            ? request.accountId()
                            : newAccountId();
                    return insert(accountId, request.accountName(), credential,
                            Provider.fromDb(request.provider()), request.region(), false, null);
                })
                .map(this::toView);
    }

    /**
     * Mint a broker-generated API key account. The plaintext key is returned exactly once;
     * its ciphertext and SHA-256 digest are stored.
     */
    @Transactional
    public Mono<GenerateAccountResponse> generateAccount(GenerateAccountRequest request) {
        KeyGeneratorService.GeneratedKey generated = keyGeneratorService.generateAccountKey();
        return insert(newAccountId(), request.accountName(), new ApiKeyCredential(generated.plaintext()),
                Provider.fromDb(request.provider()), request.region(), true, generated.hash())
                .map(saved -> GenerateAccountResponse.create(toView(saved), generated.plaintext()));
    }

    /**
     * Idempotent upsert keyed by account name, used by the credential file import.
     * An existing account keeps its id and mappings; only the secret material is replaced.
     *
     * @return true when a new account was created
     */
    @Transactional
    public Mono<Boolean> upsertByName(String accountName, String accountId, AccountCredential credential,
                                      Provider provider, String region) {
        return accountRepository.findByAccountName(accountName)
                .flatMap(existing -> {
                    checkProviderSupports(provider, credential.type());
                    String previousType = existing.getCredentialType();
                    Long previousExpiresAt = existing.getOauthExpiresAt();
                    writeCredential(existing, credential);
                    existing.setProvider(provider.dbValue());
                    existing.setRegion(effectiveRegion(provider, region != null ? region : existing.getRegion()));
                    return writeReplacement(existing, previousType, previousExpiresAt, null)
                            .then(Mono.defer(() -> writeMetadata(existing)))
                            .doOnSuccess(v -> log.info("Updated imported account {} ({})",
                                    existing.getAccountId(), accountName))
                            .thenReturn(false);
                })
                .switchIfEmpty(Mono.defer(() -> insert(accountId, accountName, credential, provider, region,
                        false, null).thenReturn(true)));
    }

    private Mono<AccountEntity> insert(String accountId, String accountName, AccountCredential credential,
                                       Provider provider, String region, boolean generated, String keyHash) {
        return accountRepository.existsByAccountName(accountName)
                .flatMap(nameTaken -> {
                    if (nameTaken) {
                        return Mono.error(new DuplicateResourceException(
                                "Account name already exists: " + accountName));
                    }
                    return accountRepository.existsById(accountId);
                })
                .flatMap(idTaken -> {
                    if (idTaken) {
                        return Mono.error(new DuplicateResourceException("Account already exists: " + accountId));
                    }
                    checkProviderSupports(provider, credential.type());
                    Instant now = clock.instant();
                    AccountEntity entity = new AccountEntity();
                    entity.setAccountId(accountId);
                    entity.setAccountName(accountName);
                    entity.setProvider(provider.dbValue());
                    entity.setRegion(effectiveRegion(provider, region));
                    entity.setOauthStatus(AccountEntity.OAUTH_STATUS_OK);
                    entity.setGenerated(generated);
                    entity.setKeyHash(keyHash);
                    entity.setActive(true);
                    entity.setCreatedAt(now);
                    entity.setUpdatedAt(now);
                    writeCredential(entity, credential);
                    return accountRepository.save(entity.markNew());
                })
                .doOnSuccess(saved -> log.info("Created {} account {} ({}, provider={}, generated={})",
                        saved.getCredentialType(), saved.getAccountId(), accountName,
                        saved.getProvider(), generated));
    }

    // ==================== Read ====================

    /**
     * Account with its secrets still encrypted.
     */
    public Mono<AccountEntity> getAccount(String accountId) {
        return accountRepository.findById(accountId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Account", accountId)));
    }

    public Mono<AccountView> getAccountView(String accountId) {
        return getAccount(accountId).map(this::toView);
    }

    public Flux<AccountView> listAccounts() {
        return accountRepository.findAllNewestFirst().map(this::toView);
    }

    /**
     * Decrypt one secret of an account. The only decryption path; callers must use the value
     * for a single outbound call and must not log or retain it.
     *
     * @throws CredentialCorruptionException when the column is empty or fails authentication
     */
    public String getDecryptedSecret(AccountEntity account, SecretField field) {
        String envelope = switch (field) {
            case API_KEY -> account.getApiKeyEncrypted();
            case OAUTH_ACCESS -> account.getOauthAccessTokenEncrypted();
            case OAUTH_REFRESH -> account.getOauthRefreshTokenEncrypted();
        };
        if (envelope == null) {
            throw new CredentialCorruptionException(
                    "Account " + account.getAccountId() + " has no stored " + field + " secret");
        }
        try {
            return cryptoService.decrypt(envelope, field.aad(account.getAccountId()));
        } catch (CredentialCorruptionException e) {
            log.error("Credential corruption on account {} field {}: {}",
                    account.getAccountId(), field, e.getMessage());
            throw e;
        }
    }

    public Mono<String> getDecryptedSecret(String accountId, SecretField field) {
        return getAccount(accountId).map(account -> getDecryptedSecret(account, field));
    }

    // ==================== Update ====================

    /**
     * Apply a partial update. A replacement credential is validated as a whole; an update
     * that would leave the row inconsistent fails without writing anything.
     * <p>
     * Metadata is written without touching secret columns, so a concurrent OAuth refresh is never rolled back.
     * A credential replacement that races a refresh fails with 409 instead of overwriting it.
     */
    @Transactional
    public Mono<AccountView> updateAccount(String accountId, UpdateAccountRequest request) {
        return getAccount(accountId)
                .flatMap(existing -> checkNameAvailable(existing, request.accountName()).thenReturn(existing))
                .flatMap(existing -> {
                    if (Boolean.TRUE.equals(request.active()) && existing.isRevoked()) {
                        return Mono.error(new ResponseStatusException(HttpStatus.CONFLICT,
                                "Revoked account cannot be reactivated: " + accountId));
                    }
                    String previousType = existing.getCredentialType();
                    Long previousExpiresAt = existing.getOauthExpiresAt();
                    if (request.replacesCredential()) {
                        CredentialType type = request.credentialType() != null
                                ? CredentialType.fromDb(request.credentialType())
                                : existing.credentialTypeValue();
                        writeCredential(existing, toCredential(type, request.apiKey(), request.oauth()));
                        existing.setOauthStatus(AccountEntity.OAUTH_STATUS_OK);
                        existing.setOauthLastError(null);
                    }
                    if (request.accountName() != null) {
                        existing.setAccountName(request.accountName());
                    }
                    if (request.provider() != null && !request.provider().isBlank()) {
                        existing.setProvider(Provider.fromDb(request.provider()).dbValue());
                    }
                    if (request.region() != null || request.provider() != null) {
                        existing.setRegion(effectiveRegion(existing.providerValue(),
                                request.region() != null ? request.region() : existing.getRegion()));
                    }
                    if (request.active() != null) {
                        existing.setActive(request.active());
                    }
                    checkProviderSupports(existing.providerValue(), existing.credentialTypeValue());
                    Mono<Void> credentialWrite = request.replacesCredential()
                            ? writeReplacement(existing, previousType, previousExpiresAt, null)
                            : Mono.empty();
                    return credentialWrite.then(Mono.defer(() -> writeMetadata(existing)));
                })
                .then(Mono.defer(() -> getAccount(accountId)))
                .doOnSuccess(saved -> log.info("Updated account {} (credentialReplaced={})",
                        accountId, request.replacesCredential()))
                .map(this::toView);
    }

    /**
     * Replace the OAuth token pair out-of-band and clear a terminal invalid_grant state.
     */
    @Transactional
    public Mono<AccountView> reauthenticate(String accountId, OAuthTokensRequest tokens) {
        return getAccount(accountId)
                .flatMap(existing -> {
                    if (existing.credentialTypeValue() != CredentialType.OAUTH) {
                        return Mono.error(new InvalidCredentialException(
                                "Account " + accountId + " is not an oauth account"));
                    }
                    if (existing.isRevoked()) {
                        return Mono.error(new ResponseStatusException(HttpStatus.CONFLICT,
                                "Revoked account cannot be re-authenticated: " + accountId));
                    }
                    boolean wasInvalid = existing.isInvalidGrant();
                    Long previousExpiresAt = existing.getOauthExpiresAt();
                    Instant now = clock.instant();
                    writeCredential(existing, toCredential(CredentialType.OAUTH, null, tokens));
                    existing.setOauthStatus(AccountEntity.OAUTH_STATUS_OK);
                    existing.setOauthLastError(null);
                    existing.setLastRefreshAt(now);
                    return writeReplacement(existing, CredentialType.OAUTH.dbValue(), previousExpiresAt, now)
                            .doOnSuccess(v -> log.info("Re-authenticated account {} (clearedInvalidGrant={})",
                                    accountId, wasInvalid));
                })
                .then(Mono.defer(() -> getAccount(accountId)))
                .map(this::toView);
    }

    /**
     * Soft revoke: the row stays for audit, routing excludes it permanently. Idempotent.
     */
    @Transactional
    public Mono<AccountView> revokeAccount(String accountId) {
        return getAccount(accountId)
                .flatMap(existing -> accountRepository.revoke(accountId)
                        .doOnNext(rows -> {
                            if (rows > 0) {
                                log.info("Revoked account {} ({})", accountId, existing.getAccountName());
                            } else {
                                log.debug("Account {} already revoked", accountId);
                            }
                        }))
                .then(getAccountView(accountId));
    }

    /**
     * Hard delete, allowed only for generated accounts. Mappings cascade; tenant defaults
     * pointing at the account are cleared.
     */
    @Transactional
    public Mono<Void> deleteAccount(String accountId) {
        return getAccount(accountId)
                .flatMap(existing -> {
                    if (!existing.isGenerated()) {
                        return Mono.error(new ResponseStatusException(HttpStatus.CONFLICT,
                                "Only generated accounts can be deleted; revoke " + accountId + " instead"));
                    }
                    return tenantRepository.clearDefaultAccount(accountId)
                            .then(accountRepository.deleteById(accountId))
                            .doOnSuccess(v -> log.info("Deleted generated account {}", accountId));
                });
    }

    /**
     * Record use of an account. Best-effort: failures are logged, never surfaced to the request.
     */
    public Mono<Void> touchLastUsed(String accountId) {
        return accountRepository.touchLastUsed(accountId)
                .doOnError(e -> log.warn("Failed to record last use of account {}: {}", accountId, e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then();
    }

    // ==================== Helper Methods ====================

    /**
     * Build the credential variant for a type from raw request fields. Secrets belonging to
     * the other type are rejected rather than silently dropped.
     */
    AccountCredential toCredential(CredentialType type, String apiKey, OAuthTokensRequest oauth) {
        if (type == CredentialType.API_KEY) {
            if (oauth != null) {
                throw new InvalidCredentialException("api_key account must not carry OAuth tokens");
            }
            return new ApiKeyCredential(apiKey);
        }
        if (apiKey != null) {
            throw new InvalidCredentialException("oauth account must not carry an API key");
        }
        if (oauth == null) {
            throw new InvalidCredentialException("oauth account requires access and refresh tokens");
        }
        return new OAuthCredential(
                oauth.accessToken(),
                oauth.refreshToken(),
                oauth.expiresAt(),
                oauth.scopes() != null ? new HashSet<>(oauth.scopes()) : null,
                Boolean.TRUE.equals(oauth.isMax()));
    }

    private void writeCredential(AccountEntity entity, AccountCredential credential) {
        String accountId = entity.getAccountId();
        credential.writeTo(entity, (field, plaintext) -> cryptoService.encrypt(plaintext, field.aad(accountId)));
    }

    /**
     * Persist the secret columns of {@code updated}, guarded on what was read before it was modified.
     */
    private Mono<Void> writeReplacement(AccountEntity updated, String previousType, Long previousExpiresAt,
                                        Instant lastRefreshAt) {
        String accountId = updated.getAccountId();
        return accountRepository.replaceCredential(accountId, updated.getCredentialType(),
                        updated.getApiKeyEncrypted(), updated.getOauthAccessTokenEncrypted(),
                        updated.getOauthRefreshTokenEncrypted(), updated.getSecretHint(),
                        updated.getOauthExpiresAt(), updated.getOauthScopes(), updated.isOauthIsMax(),
                        lastRefreshAt, previousType, previousExpiresAt)
                .flatMap(rows -> {
                    if (rows == 0) {
                        log.warn("Credential replacement for account {} lost a race with a concurrent write",
                                accountId);
                        return Mono.<Void>error(new ResponseStatusException(HttpStatus.CONFLICT,
                                "Credentials of account " + accountId + " changed concurrently; reload and retry"));
                    }
                    return Mono.<Void>empty();
                });
    }

    private Mono<Void> writeMetadata(AccountEntity updated) {
        return accountRepository.updateMetadata(updated.getAccountId(), updated.getAccountName(),
                        updated.getProvider(), updated.getRegion(), updated.isActive())
                .then();
    }

    private Mono<Void> checkNameAvailable(AccountEntity existing, String newName) {
        if (newName == null || newName.equals(existing.getAccountName())) {
            return Mono.empty();
        }
        return accountRepository.existsByAccountName(newName)
                .flatMap(taken -> taken
                        ? Mono.error(new DuplicateResourceException("Account name already exists: " + newName))
                        : Mono.empty());
    }

    /**
     * Bedrock accepts API keys only.
     */
    static void checkProviderSupports(Provider provider, CredentialType type) {
        if (provider == Provider.BEDROCK && type != CredentialType.API_KEY) {
            throw new InvalidCredentialException("bedrock accounts require an api_key credential");
        }
    }

    private String effectiveRegion(Provider provider, String region) {
        if (provider != Provider.BEDROCK) {
            return null;
        }
        return region != null && !region.isBlank() ? region : defaultRegion;
    }

    private static String newAccountId() {
        return ACCOUNT_ID_PREFIX + UUID.randomUUID();
    }

    AccountView toView(AccountEntity entity) {
        String hint = entity.getSecretHint();
        String preview = entity.getProvider() + ":" + (hint != null ? "****" + hint : "****");
        return new AccountView(
                entity.getAccountId(),
                entity.getAccountName(),
                entity.getCredentialType(),
                entity.getProvider(),
                entity.getRegion(),
                preview,
                stateEvaluator.stateOf(entity),
                entity.getOauthExpiresAt(),
                OAuthCredential.parseScopes(entity.getOauthScopes()),
                entity.isOauthIsMax(),
                entity.getOauthLastError(),
                entity.getLastRefreshAt(),
                entity.isGenerated(),
                entity.isActive(),
                entity.isRevoked(),
                entity.getRevokedAt(),
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                entity.getLastUsedAt()
        );
    }
}
