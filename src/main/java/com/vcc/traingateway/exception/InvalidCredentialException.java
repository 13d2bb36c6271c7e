package com.vcc.traingateway.exception;

/**
 * A write would leave an account whose secrets do not match its credential type.
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message) {
        super(message);
    }
}
