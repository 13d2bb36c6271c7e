package com.vcc.traingateway.model;

import java.util.Locale;

/**
 * Upstream an account calls: the direct Anthropic API or hosted inference on Bedrock.
 */
public enum Provider {
    ANTHROPIC("anthropic"),
    BEDROCK("bedrock");

    private final String dbValue;

    Provider(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    /**
     * Null or blank means the direct API.
     */
    public static Provider fromDb(String value) {
        if (value == null || value.isBlank()) {
            return ANTHROPIC;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Provider provider : values()) {
            if (provider.dbValue.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }
}
