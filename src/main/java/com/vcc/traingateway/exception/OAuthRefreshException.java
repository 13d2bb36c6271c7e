package com.vcc.traingateway.exception;

/**
 * OAuth refresh failure, split into retryable and terminal outcomes.
 */
public class OAuthRefreshException extends RuntimeException {

    public enum Kind {
        /** Network error, timeout or 5xx. Account state is unchanged. */
        TRANSIENT,
        /** Provider rejected the refresh token. Needs out-of-band re-authentication. */
        INVALID_GRANT
    }

    private final Kind kind;
    private final String accountId;

    public OAuthRefreshException(Kind kind, String accountId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.accountId = accountId;
    }

    public static OAuthRefreshException transientFailure(String accountId, String message, Throwable cause) {
        return new OAuthRefreshException(Kind.TRANSIENT, accountId, message, cause);
    }

    public static OAuthRefreshException invalidGrant(String accountId, String message) {
        return new OAuthRefreshException(Kind.INVALID_GRANT, accountId, message, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getAccountId() {
        return accountId;
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT;
    }

    /**
     * Copy bound to a concrete account, for failures raised before the account was known.
     */
    public OAuthRefreshException forAccount(String accountId) {
        return new OAuthRefreshException(kind, accountId, getMessage(), getCause());
    }
}
