package com.vcc.traingateway.exception;

/**
 * A stored secret failed authenticated decryption: it was tampered with, truncated,
 * or encrypted under a master key this process does not hold.
 */
public class CredentialCorruptionException extends RuntimeException {

    public CredentialCorruptionException(String message) {
        super(message);
    }

    public CredentialCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
