package com.vcc.traingateway.exception;

/**
 * Routing failed closed: the tenant has no mapped account that can serve the request.
 */
public class ConfigurationException extends RuntimeException {

    public enum Reason {
        NO_USABLE_ACCOUNT
    }

    private final Reason reason;
    private final String tenantId;

    public ConfigurationException(Reason reason, String tenantId, String message) {
        super(message);
        this.reason = reason;
        this.tenantId = tenantId;
    }

    public static ConfigurationException noUsableAccount(String tenantId) {
        return new ConfigurationException(Reason.NO_USABLE_ACCOUNT, tenantId,
                "No usable account mapped to tenant " + tenantId);
    }

    public Reason getReason() {
        return reason;
    }

    public String getTenantId() {
        return tenantId;
    }
}
