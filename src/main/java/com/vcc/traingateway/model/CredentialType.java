package com.vcc.traingateway.model;

import java.util.Locale;

public enum CredentialType {
    API_KEY("api_key"),
    OAUTH("oauth");

    private final String dbValue;

    CredentialType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static CredentialType fromDb(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Credential type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CredentialType type : values()) {
            if (type.dbValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown credential type: " + value);
    }
}
