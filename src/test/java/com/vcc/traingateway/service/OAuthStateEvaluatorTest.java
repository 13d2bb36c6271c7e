package com.vcc.traingateway.service;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.model.OAuthState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class OAuthStateEvaluatorTest {

    private final long now = TestAccounts.NOW.toEpochMilli();
    private final OAuthStateEvaluator evaluator =
            new OAuthStateEvaluator(Clock.fixed(TestAccounts.NOW, ZoneOffset.UTC), new GwProperties());

    @Test
    void apiKeyAccount_hasNoOAuthState() {
        assertNull(evaluator.stateOf(TestAccounts.apiKeyAccount("acc_a")));
    }

    @Test
    void stateFollowsExpiryAndSkew() {
        assertEquals(OAuthState.VALID, evaluator.stateOf(TestAccounts.oauthAccount("a", now + 3_600_000)));
        assertEquals(OAuthState.EXPIRING_SOON, evaluator.stateOf(TestAccounts.oauthAccount("a", now + 30_000)));
        assertEquals(OAuthState.EXPIRING_SOON, evaluator.stateOf(TestAccounts.oauthAccount("a", now + 60_000)));
        assertEquals(OAuthState.EXPIRED, evaluator.stateOf(TestAccounts.oauthAccount("a", now)));
        assertEquals(OAuthState.EXPIRED, evaluator.stateOf(TestAccounts.oauthAccount("a", now - 1)));
    }

    @Test
    void missingExpiry_isTreatedAsExpired() {
        assertEquals(OAuthState.EXPIRED, evaluator.stateOf(TestAccounts.oauthAccount("a", null)));
    }

    @Test
    void invalidGrant_winsOverExpiry() {
        AccountEntity account = TestAccounts.oauthAccount("a", now + 3_600_000);
        account.setOauthStatus(AccountEntity.OAUTH_STATUS_INVALID_GRANT);

        assertEquals(OAuthState.INVALID_GRANT, evaluator.stateOf(account));
    }

    @Test
    void refreshDeadline_isNowPlusSkew() {
        assertEquals(now + 60_000, evaluator.refreshDeadline());
    }
}
