package com.vcc.traingateway.service;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.model.CredentialType;
import com.vcc.traingateway.model.OAuthState;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Derives an account's {@link OAuthState} from its stored expiry, the clock and the refresh skew.
 */
@Component
public class OAuthStateEvaluator {

    private final Clock clock;
    private final long skewMillis;

    public OAuthStateEvaluator(Clock clock, GwProperties properties) {
        this.clock = clock;
        this.skewMillis = properties.getOauth().getRefreshSkew().toMillis();
    }

    /**
     * @return the OAuth state, or null for non-OAuth accounts
     */
    public OAuthState stateOf(AccountEntity account) {
        if (account.credentialTypeValue() != CredentialType.OAUTH) {
            return null;
        }
        if (account.isInvalidGrant()) {
            return OAuthState.INVALID_GRANT;
        }
        Long expiresAt = account.getOauthExpiresAt();
        if (expiresAt == null) {
            // Unknown expiry: refresh before first use
            return OAuthState.EXPIRED;
        }
        long now = clock.millis();
        if (now >= expiresAt) {
            return OAuthState.EXPIRED;
        }
        if (now >= expiresAt - skewMillis) {
            return OAuthState.EXPIRING_SOON;
        }
        return OAuthState.VALID;
    }

    public long refreshDeadline() {
        return clock.millis() + skewMillis;
    }

    public long nowMillis() {
        return clock.millis();
    }
}
