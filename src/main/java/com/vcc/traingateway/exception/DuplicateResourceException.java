package com.vcc.traingateway.exception;

/**
 * Exception thrown when creating a resource whose natural key already exists.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }
}
