package com.vcc.traingateway.model;

/**
 * Derived OAuth state of an account. Only INVALID_GRANT is persisted; the rest follow from
 * the stored expiry and the clock.
 */
public enum OAuthState {
    VALID,
    EXPIRING_SOON,
    EXPIRED,
    INVALID_GRANT;

    public boolean needsRefresh() {
        return this == EXPIRING_SOON || this == EXPIRED;
    }
}
