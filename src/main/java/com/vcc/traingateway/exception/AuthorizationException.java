package com.vcc.traingateway.exception;

/**
 * Raised when the token is valid but the tenant it belongs to may not use the gateway.
 */
public class AuthorizationException extends RuntimeException {

    public enum Reason {
        TENANT_INACTIVE
    }

    private final Reason reason;
    private final String tenantId;

    public AuthorizationException(Reason reason, String tenantId) {
        super("Tenant is not active: " + tenantId);
        this.reason = reason;
        this.tenantId = tenantId;
    }

    public static AuthorizationException tenantInactive(String tenantId) {
        return new AuthorizationException(Reason.TENANT_INACTIVE, tenantId);
    }

    public Reason getReason() {
        return reason;
    }

    public String getTenantId() {
        return tenantId;
    }
}
