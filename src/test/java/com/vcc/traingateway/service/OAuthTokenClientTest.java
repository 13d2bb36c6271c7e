package com.vcc.traingateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.exception.OAuthRefreshException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class OAuthTokenClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private GwProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GwProperties();
        properties.getOauth().setTimeout(Duration.ofMillis(200));
    }

    private OAuthTokenClient clientReturning(HttpStatus status, String body) {
        ExchangeFunction exchange = request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        };
        return new OAuthTokenClient(WebClient.builder().exchangeFunction(exchange), objectMapper, properties);
    }

    @Test
    void refresh_success_parsesTokenSet() {
        OAuthTokenClient client = clientReturning(HttpStatus.OK,
                "{\"access_token\":\"new-access\",\"refresh_token\":\"new-refresh\",\"expires_in\":3600,"
                        + "\"scope\":\"user:inference\",\"token_type\":\"Bearer\"}");

        StepVerifier.create(client.refresh("old-refresh"))
                .expectNextMatches(token -> token.accessToken().equals("new-access")
                        && token.refreshToken().equals("new-refresh")
                        && token.expiresIn() == 3600L
                        && "user:inference".equals(token.scope()))
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertEquals(properties.getOauth().getTokenUrl(), request.url().toString());
        assertEquals("oauth-2025-04-20", request.headers().getFirst("anthropic-beta"));
    }

    @Test
    void refresh_withoutRotation_leavesRefreshTokenNull() {
        OAuthTokenClient client = clientReturning(HttpStatus.OK,
                "{\"access_token\":\"new-access\",\"expires_in\":3600}");

        StepVerifier.create(client.refresh("old-refresh"))
                .expectNextMatches(token -> token.refreshToken() == null)
                .verifyComplete();
    }

    @Test
    void refresh_invalidGrant_isTerminal() {
        OAuthTokenClient client = clientReturning(HttpStatus.BAD_REQUEST,
                "{\"error\":\"invalid_grant\",\"error_description\":\"Refresh token revoked\"}");

        StepVerifier.create(client.refresh("old-refresh"))
                .expectErrorMatches(e -> e instanceof OAuthRefreshException
                        && ((OAuthRefreshException) e).getKind() == OAuthRefreshException.Kind.INVALID_GRANT)
                .verify();
    }

    @Test
    void refresh_otherClientError_isTransient() {
        OAuthTokenClient client = clientReturning(HttpStatus.BAD_REQUEST,
                "{\"error\":\"invalid_request\"}");

        StepVerifier.create(client.refresh("old-refresh"))
                .expectErrorMatches(e -> e instanceof OAuthRefreshException
                        && ((OAuthRefreshException) e).isRetryable())
                .verify();
    }

    @Test
    void refresh_serverError_isTransient() {
        OAuthTokenClient client = clientReturning(HttpStatus.BAD_GATEWAY, "<html>bad gateway</html>");

        StepVerifier.create(client.refresh("old-refresh"))
                .expectErrorMatches(e -> e instanceof OAuthRefreshException
                        && ((OAuthRefreshException) e).getKind() == OAuthRefreshException.Kind.TRANSIENT)
                .verify();
    }

    @Test
    void refresh_missingAccessToken_isTransient() {
        OAuthTokenClient client = clientReturning(HttpStatus.OK, "{\"expires_in\":3600}");

        StepVerifier.create(client.refresh("old-refresh"))
                .expectErrorMatches(e -> e instanceof OAuthRefreshException
                        && ((OAuthRefreshException) e).isRetryable())
                .verify();
    }

    @Test
    void refresh_timeout_isTransient() {
        ExchangeFunction hanging = request -> Mono.never();
        OAuthTokenClient client = new OAuthTokenClient(WebClient.builder().exchangeFunction(hanging),
                objectMapper, properties);

        StepVerifier.create(client.refresh("old-refresh"))
                .expectErrorMatches(e -> e instanceof OAuthRefreshException
                        && ((OAuthRefreshException) e).isRetryable())
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void tokenResponse_toStringIsMasked() {
        OAuthTokenClient.TokenResponse token =
                new OAuthTokenClient.TokenResponse("access-secret-value", "refresh-secret-value", 60L, null, null);

        assertFalse(token.toString().contains("secret-value"));
    }
}
