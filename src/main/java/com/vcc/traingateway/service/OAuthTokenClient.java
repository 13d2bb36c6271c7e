package com.vcc.traingateway.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.exception.OAuthRefreshException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Client for the provider's OAuth token endpoint (refresh_token grant).
 * Every failure surfaces as {@link OAuthRefreshException}: {@code invalid_grant} is terminal,
 * anything else (network, timeout, 5xx, unexpected payload) is transient.
 */
@Service
public class OAuthTokenClient {
    private static final Logger log = LoggerFactory.getLogger(OAuthTokenClient.class);

    static final String INVALID_GRANT = "invalid_grant";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String tokenUrl;
    private final String clientId;
    private final String betaHeader;
    private final Duration timeout;

    public OAuthTokenClient(WebClient.Builder builder, ObjectMapper objectMapper, GwProperties properties) {
        GwProperties.OAuthConfig oauth = properties.getOauth();
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
        this.tokenUrl = oauth.getTokenUrl();
        this.clientId = oauth.getClientId();
        this.betaHeader = oauth.getBetaHeader();
        this.timeout = oauth.getTimeout();
    }

    /**
     * Exchange a refresh token for a new token set.
     */
    public Mono<TokenResponse> refresh(String refreshToken) {
        WebClient.RequestBodySpec request = webClient.post()
                .uri(tokenUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);
        if (betaHeader != null && !betaHeader.isBlank()) {
            request = request.header("anthropic-beta", betaHeader);
        }
        return request
                .bodyValue(Map.of(
                        "client_id", clientId,
                        "refresh_token", refreshToken,
                        "grant_type", "refresh_token"))
                .exchangeToMono(response -> {
                    HttpStatusCode status = response.statusCode();
                    if (status.is2xxSuccessful()) {
                        return response.bodyToMono(TokenResponse.class)
                                .switchIfEmpty(Mono.error(transientError("Empty token response", null)))
                                .flatMap(this::validate);
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(classify(status, body)));
                })
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof OAuthRefreshException), e -> {
                    if (e instanceof TimeoutException) {
                        return transientError("Token endpoint timed out after " + timeout.toMillis() + "ms", e);
                    }
                    return transientError("Token endpoint call failed: " + e.getMessage(), e);
                });
    }

    private Mono<TokenResponse> validate(TokenResponse token) {
        if (token.accessToken() == null || token.accessToken().isBlank() || token.expiresIn() == null) {
            return Mono.error(transientError("Token response missing access_token or expires_in", null));
        }
        return Mono.just(token);
    }

    OAuthRefreshException classify(HttpStatusCode status, String body) {
        String error = null;
        String description = null;
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root != null) {
                error = root.path("error").isTextual() ? root.path("error").asText() : null;
                description = root.path("error_description").isTextual()
                        ? root.path("error_description").asText()
                        : null;
            }
        } catch (IOException e) {
            log.debug("Token endpoint returned a non-JSON error body (status={})", status.value());
        }

        String message = "Token endpoint returned " + status.value()
                + (error != null ? " " + error : "")
                + (description != null ? ": " + description : "");
        if (INVALID_GRANT.equals(error)) {
            return OAuthRefreshException.invalidGrant(null, message);
        }
        return transientError(message, null);
    }

    private static OAuthRefreshException transientError(String message, Throwable cause) {
        return OAuthRefreshException.transientFailure(null, message, cause);
    }

    /**
     * Successful token endpoint payload. {@code refresh_token} and {@code is_max} are optional.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TokenResponse(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("refresh_token") String refreshToken,
            @JsonProperty("expires_in") Long expiresIn,
            @JsonProperty("scope") String scope,
            @JsonProperty("is_max") Boolean isMax
    ) {
        @Override
        public String toString() {
            return "TokenResponse[expiresIn=" + expiresIn + ", scope=" + scope + ", isMax=" + isMax
                    + ", rotated=" + (refreshToken != null) + "]";
        }
    }
}
