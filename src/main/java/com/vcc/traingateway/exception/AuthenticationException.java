package com.vcc.traingateway.exception;

/**
 * Raised when an inbound request carries no usable client bearer token.
 * Always surfaces as 401 with a {@code WWW-Authenticate} challenge.
 */
public class AuthenticationException extends RuntimeException {

    public enum Reason {
        MISSING("Missing Authorization header. Please provide a Bearer token."),
        MALFORMED("Invalid Authorization header format. Expected: Bearer <token>"),
        INVALID("Invalid client API key. Please check your Bearer token.");

        private final String clientMessage;

        Reason(String clientMessage) {
            this.clientMessage = clientMessage;
        }

        public String clientMessage() {
            return clientMessage;
        }
    }

    private final Reason reason;

    public AuthenticationException(Reason reason) {
        super(reason.clientMessage());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
