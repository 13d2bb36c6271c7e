package com.vcc.traingateway.service;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.crypto.AesGcmCryptoService;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.exception.OAuthRefreshException;
import com.vcc.traingateway.model.SecretField;
import com.vcc.traingateway.repository.AccountRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OAuthLifecycleManagerTest {

    private static final String ACCOUNT_ID = "acc_oauth";

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private AccountService accountService;

    @Mock
    private AesGcmCryptoService cryptoService;

    @Mock
    private OAuthTokenClient tokenClient;

    private final long now = TestAccounts.NOW.toEpochMilli();
    private OAuthLifecycleManager lifecycleManager;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TestAccounts.NOW, ZoneOffset.UTC);
        OAuthStateEvaluator evaluator = new OAuthStateEvaluator(clock, new GwProperties());
        lifecycleManager = new OAuthLifecycleManager(accountRepository, accountService, cryptoService,
                tokenClient, evaluator, clock);
    }

    private AccountEntity expiringAccount() {
        AccountEntity account = TestAccounts.oauthAccount(ACCOUNT_ID, now + 10_000);
        when(accountRepository.findById(ACCOUNT_ID)).thenReturn(Mono.just(account));
        when(accountService.getDecryptedSecret(account, SecretField.OAUTH_REFRESH)).thenReturn("refresh-plain");
        return account;
    }

    private void stubEncryption() {
        when(cryptoService.encrypt(anyString(), anyString()))
                .thenAnswer(invocation -> "enc:" + invocation.getArgument(0));
    }

    @Test
    void ensureFresh_validToken_skipsProvider() {
        AccountEntity account = TestAccounts.oauthAccount(ACCOUNT_ID, now + 3_600_000);

        StepVerifier.create(lifecycleManager.ensureFresh(account))
                .expectNext(account)
                .verifyComplete();

        verify(tokenClient, never()).refresh(anyString());
    }

    @Test
    void ensureFresh_apiKeyAccount_passesThrough() {
        AccountEntity account = TestAccounts.apiKeyAccount("acc_key");

        StepVerifier.create(lifecycleManager.ensureFresh(account))
                .expectNext(account)
                .verifyComplete();
    }

    @Test
    void refresh_rotatedRefreshToken_replacesStoredToken() {
        AccountEntity account = expiringAccount();
        stubEncryption();
        when(tokenClient.refresh("refresh-plain")).thenReturn(Mono.just(
                new OAuthTokenClient.TokenResponse("access-new-1234", "refresh-new", 3600L, null, null)));
        when(accountRepository.applyOAuthRefresh(eq(ACCOUNT_ID), eq("enc:access-new-1234"), eq("enc:refresh-new"),
                eq("1234"), eq(now + 3_600_000L), eq("user:inference user:profile"), eq(false),
                eq(now + 10_000L))).thenReturn(Mono.just(1));

        StepVerifier.create(lifecycleManager.ensureFresh(account))
                .expectNextMatches(refreshed -> refreshed.getOauthExpiresAt() == now + 3_600_000L
                        && "enc:refresh-new".equals(refreshed.getOauthRefreshTokenEncrypted()))
                .verifyComplete();
    }

    @Test
    void refresh_withoutRotation_keepsStoredRefreshToken() {
        AccountEntity account = expiringAccount();
        stubEncryption();
        when(tokenClient.refresh("refresh-plain")).thenReturn(Mono.just(
                new OAuthTokenClient.TokenResponse("access-new-1234", null, 3600L, "user:inference", true)));
        when(accountRepository.applyOAuthRefresh(eq(ACCOUNT_ID), eq("enc:access-new-1234"),
                eq("v1:iv:refresh-" + ACCOUNT_ID), anyString(), anyLong(), eq("user:inference"), eq(true),
                eq(now + 10_000L))).thenReturn(Mono.just(1));

        StepVerifier.create(lifecycleManager.refresh(ACCOUNT_ID))
                .expectNextMatches(refreshed -> refreshed.getOauthRefreshTokenEncrypted()
                        .equals("v1:iv:refresh-" + ACCOUNT_ID) && refreshed.isOauthIsMax())
                .verifyComplete();
    }

    @Test
    void refresh_invalidGrant_marksAccountAndFails() {
        AccountEntity account = expiringAccount();
        when(tokenClient.refresh("refresh-plain"))
                .thenReturn(Mono.error(OAuthRefreshException.invalidGrant(null, "invalid_grant")));
        when(accountRepository.markInvalidGrant(eq(ACCOUNT_ID), anyString(), eq(now + 10_000L)))
                .thenReturn(Mono.just(1));

        StepVerifier.create(lifecycleManager.refresh(ACCOUNT_ID))
                .expectErrorMatches(e -> e instanceof OAuthRefreshException
                        && ((OAuthRefreshException) e).getKind() == OAuthRefreshException.Kind.INVALID_GRANT
                        && ACCOUNT_ID.equals(((OAuthRefreshException) e).getAccountId()))
                .verify();

        assertEquals(AccountEntity.OAUTH_STATUS_INVALID_GRANT, account.getOauthStatus());
    }

    @Test
    void refresh_invalidGrantAfterConcurrentRotation_usesRotatedTokens() {
        AccountEntity stale = TestAccounts.oauthAccount(ACCOUNT_ID, now + 10_000);
        AccountEntity rotated = TestAccounts.oauthAccount(ACCOUNT_ID, now + 3_600_000);
        when(accountRepository.findById(ACCOUNT_ID)).thenReturn(Mono.just(stale), Mono.just(rotated));
        when(accountService.getDecryptedSecret(stale, SecretField.OAUTH_REFRESH)).thenReturn("refresh-plain");
        when(tokenClient.refresh("refresh-plain"))
                .thenReturn(Mono.error(OAuthRefreshException.invalidGrant(null, "invalid_grant")));
        when(accountRepository.markInvalidGrant(eq(ACCOUNT_ID), anyString(), eq(now + 10_000L)))
                .thenReturn(Mono.just(0));

        StepVerifier.create(lifecycleManager.refresh(ACCOUNT_ID))
                .expectNext(rotated)
                .verifyComplete();
    }

    @Test
    void refresh_transientFailure_leavesAccountUntouched() {
        expiringAccount();
        when(tokenClient.refresh("refresh-plain"))
                .thenReturn(Mono.error(OAuthRefreshException.transientFailure(null, "timeout", null)));

        StepVerifier.create(lifecycleManager.refresh(ACCOUNT_ID))
                .expectErrorMatches(e -> e instanceof OAuthRefreshException
                        && ((OAuthRefreshException) e).isRetryable())
                .verify();

        verify(accountRepository, never()).markInvalidGrant(anyString(), anyString(), any());
        verify(accountRepository, never()).applyOAuthRefresh(anyString(), anyString(), anyString(), any(),
                any(), any(), anyBoolean(), any());
    }

    @Test
    void refresh_lostDatabaseRace_returnsWinnersTokens() {
        AccountEntity stale = TestAccounts.oauthAccount(ACCOUNT_ID, now + 10_000);
        AccountEntity winner = TestAccounts.oauthAccount(ACCOUNT_ID, now + 3_600_000);
        when(accountRepository.findById(ACCOUNT_ID)).thenReturn(Mono.just(stale), Mono.just(winner));
        when(accountService.getDecryptedSecret(stale, SecretField.OAUTH_REFRESH)).thenReturn("refresh-plain");
        stubEncryption();
        when(tokenClient.refresh("refresh-plain")).thenReturn(Mono.just(
                new OAuthTokenClient.TokenResponse("access-new-1234", "refresh-new", 3600L, null, null)));
        when(accountRepository.applyOAuthRefresh(anyString(), anyString(), anyString(), anyString(), anyLong(),
                anyString(), anyBoolean(), eq(now + 10_000L))).thenReturn(Mono.just(0));

        StepVerifier.create(lifecycleManager.refresh(ACCOUNT_ID))
                .expectNext(winner)
                .verifyComplete();
    }

    @Test
    void refresh_concurrentCallers_shareOneProviderCall() {
        expiringAccount();
        stubEncryption();
        Sinks.One<OAuthTokenClient.TokenResponse> provider = Sinks.one();
        when(tokenClient.refresh("refresh-plain")).thenReturn(provider.asMono());
        when(accountRepository.applyOAuthRefresh(anyString(), anyString(), anyString(), anyString(), anyLong(),
                anyString(), anyBoolean(), eq(now + 10_000L))).thenReturn(Mono.just(1));

        Mono<AccountEntity> first = lifecycleManager.refresh(ACCOUNT_ID);
        Mono<AccountEntity> second = lifecycleManager.refresh(ACCOUNT_ID);

        StepVerifier.create(Mono.zip(first, second))
                .then(() -> {
                    assertEquals(1, lifecycleManager.inFlightCount());
                    provider.tryEmitValue(
                            new OAuthTokenClient.TokenResponse("access-new-1234", "refresh-new", 3600L, null, null));
                })
                .assertNext(pair -> assertSame(pair.getT1(), pair.getT2()))
                .verifyComplete();

        verify(tokenClient, times(1)).refresh("refresh-plain");
        assertEquals(0, lifecycleManager.inFlightCount());
    }

    @Test
    void refresh_invalidGrantAccount_doesNotCallProvider() {
        AccountEntity account = TestAccounts.oauthAccount(ACCOUNT_ID, now - 1);
        account.setOauthStatus(AccountEntity.OAUTH_STATUS_INVALID_GRANT);

        StepVerifier.create(lifecycleManager.ensureFresh(account))
                .expectError(OAuthRefreshException.class)
                .verify();

        verify(tokenClient, never()).refresh(anyString());
    }

    @Test
    void forceRefresh_validToken_stillRefreshes() {
        AccountEntity account = TestAccounts.oauthAccount(ACCOUNT_ID, now + 3_600_000);
        when(accountRepository.findById(ACCOUNT_ID)).thenReturn(Mono.just(account));
        when(accountService.getDecryptedSecret(account, SecretField.OAUTH_REFRESH)).thenReturn("refresh-plain");
        stubEncryption();
        when(tokenClient.refresh("refresh-plain")).thenReturn(Mono.just(
                new OAuthTokenClient.TokenResponse("access-new-1234", null, 7200L, null, null)));
        when(accountRepository.applyOAuthRefresh(anyString(), anyString(), anyString(), anyString(), anyLong(),
                anyString(), anyBoolean(), eq(now + 3_600_000L))).thenReturn(Mono.just(1));

        StepVerifier.create(lifecycleManager.forceRefresh(ACCOUNT_ID))
                .expectNextMatches(refreshed -> refreshed.getOauthExpiresAt() == now + 7_200_000L)
                .verifyComplete();
    }
}
