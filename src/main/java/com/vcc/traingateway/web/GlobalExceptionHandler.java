package com.vcc.traingateway.web;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.dto.ErrorResponse;
import com.vcc.traingateway.exception.AuthenticationException;
import com.vcc.traingateway.exception.AuthorizationException;
import com.vcc.traingateway.exception.ConfigurationException;
import com.vcc.traingateway.exception.CredentialCorruptionException;
import com.vcc.traingateway.exception.DuplicateResourceException;
import com.vcc.traingateway.exception.InvalidCredentialException;
import com.vcc.traingateway.exception.OAuthRefreshException;
import com.vcc.traingateway.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Maps the error taxonomy to status codes and the upstream error body shape.
 * Messages of unexpected and credential errors never reach the client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final String challenge;

    public GlobalExceptionHandler(GwProperties properties) {
        this.challenge = "Bearer realm=\"" + properties.getAuth().getRealm() + "\"";
    }

    @ExceptionHandler(AuthenticationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAuthentication(AuthenticationException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, challenge)
                .body(ErrorResponse.of("authentication_error", ex.getReason().clientMessage())));
    }

    @ExceptionHandler(AuthorizationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAuthorization(AuthorizationException ex) {
        return respond(HttpStatus.FORBIDDEN, "permission_error", "Tenant is not active");
    }

    @ExceptionHandler(ConfigurationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConfiguration(ConfigurationException ex) {
        log.warn("Routing failed: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "api_error", "No usable upstream account is configured");
    }

    @ExceptionHandler(OAuthRefreshException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleOAuthRefresh(OAuthRefreshException ex) {
        log.warn("OAuth refresh failed for account {} ({}): {}", ex.getAccountId(), ex.getKind(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "api_error", "Upstream credential is temporarily unavailable");
    }

    @ExceptionHandler(CredentialCorruptionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCorruption(CredentialCorruptionException ex) {
        log.error("Stored credential could not be decrypted: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "api_error", "Internal server error");
    }

    @ExceptionHandler(InvalidCredentialException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidCredential(InvalidCredentialException ex) {
        log.warn("Invalid credential: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid_request_error", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "not_found_error", ex.getMessage());
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDuplicateResource(DuplicateResourceException ex) {
        log.warn("Duplicate resource: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "invalid_request_error", ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "invalid_request_error", "Validation failed: " + errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInput(ServerWebInputException ex) {
        log.warn("Bad request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "invalid_request_error",
                ex.getReason() != null ? ex.getReason() : "Invalid request");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        String reason = ex.getReason() != null ? ex.getReason() : "Request failed";
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", status.value(), reason);
        } else {
            log.debug("Request failed with {}: {}", status.value(), reason);
        }
        return Mono.just(ResponseEntity.status(status).body(ErrorResponse.of(errorType(status), reason)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid_request_error", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "api_error", "Internal server error");
    }

    private static Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String type, String message) {
        return Mono.just(ResponseEntity.status(status).body(ErrorResponse.of(type, message)));
    }

    private static String errorType(HttpStatusCode status) {
        switch (status.value()) {
            case 400:
            case 409:
                return "invalid_request_error";
            case 401:
                return "authentication_error";
            case 403:
                return "permission_error";
            case 404:
                return "not_found_error";
            case 429:
                return "rate_limit_error";
            default:
                return "api_error";
        }
    }
}
