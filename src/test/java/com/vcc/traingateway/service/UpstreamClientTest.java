package com.vcc.traingateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.model.Provider;
import com.vcc.traingateway.model.RoutedAccount;
import com.vcc.traingateway.model.SecretField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.server.reactive.MockServerHttpResponse;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UpstreamClientTest {

    private static final byte[] BODY = ("{\"model\":\"claude-3-haiku-20240307\",\"stream\":true,"
            + "\"max_tokens\":16,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
            .getBytes(StandardCharsets.UTF_8);

    @Mock
    private AccountService accountService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GwProperties properties;
    private UpstreamClient upstreamClient;

    @BeforeEach
    void setUp() {
        properties = new GwProperties();
        upstreamClient = new UpstreamClient(WebClient.builder(), properties, accountService, objectMapper);
    }

    private JsonNode json(byte[] body) throws IOException {
        return objectMapper.readTree(body);
    }

    @Test
    void buildRequest_anthropicApiKey_usesXApiKey() throws IOException {
        AccountEntity account = TestAccounts.apiKeyAccount("acc_a");
        when(accountService.getDecryptedSecret(account, SecretField.API_KEY)).thenReturn("sk-ant-api03-plain");

        UpstreamClient.OutboundRequest request = upstreamClient.buildRequest(
                new RoutedAccount(account, Provider.ANTHROPIC, "claude-3-haiku-20240307"), BODY, true);

        assertEquals("https://api.anthropic.com/v1/messages", request.uri().toString());
        assertEquals("sk-ant-api03-plain", request.headers().getFirst("x-api-key"));
        assertNull(request.headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("2023-06-01", request.headers().getFirst("anthropic-version"));
        assertEquals(MediaType.TEXT_EVENT_STREAM, request.headers().getAccept().get(0));
        assertEquals(true, json(request.body()).get("stream").booleanValue());
        assertFalse(request.toString().contains("sk-ant-api03-plain"));
    }

    @Test
    void buildRequest_anthropicOAuth_usesBearerAndBeta() {
        AccountEntity account = TestAccounts.oauthAccount("acc_o", TestAccounts.NOW.toEpochMilli());
        when(accountService.getDecryptedSecret(account, SecretField.OAUTH_ACCESS)).thenReturn("oauth-access");

        UpstreamClient.OutboundRequest request = upstreamClient.buildRequest(
                new RoutedAccount(account, Provider.ANTHROPIC, "claude-3-haiku-20240307"), BODY, false);

        assertEquals("Bearer oauth-access", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("oauth-2025-04-20", request.headers().getFirst("anthropic-beta"));
        assertNull(request.headers().getFirst("x-api-key"));
    }

    @Test
    void buildRequest_bedrock_movesModelIntoPath() throws IOException {
        AccountEntity account = TestAccounts.apiKeyAccount("acc_br");
        account.setProvider("bedrock");
        account.setRegion("eu-west-1");
        when(accountService.getDecryptedSecret(account, SecretField.API_KEY)).thenReturn("bedrock-key");

        UpstreamClient.OutboundRequest request = upstreamClient.buildRequest(
                new RoutedAccount(account, Provider.BEDROCK, "us.anthropic.claude-3-haiku-20240307-v1:0"),
                BODY, true);

        assertEquals("https://bedrock-runtime.eu-west-1.amazonaws.com/model/"
                        + "us.anthropic.claude-3-haiku-20240307-v1%3A0/invoke-with-response-stream",
                request.uri().toString());
        assertEquals("Bearer bedrock-key", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
        JsonNode payload = json(request.body());
        assertFalse(payload.has("model"));
        assertFalse(payload.has("stream"));
        assertEquals(UpstreamClient.BEDROCK_ANTHROPIC_VERSION, payload.get("anthropic_version").asText());
        assertEquals(16, payload.get("max_tokens").asInt());
    }

    @Test
    void buildRequest_bedrockWithoutRegion_usesDefault() {
        AccountEntity account = TestAccounts.apiKeyAccount("acc_br");
        account.setProvider("bedrock");
        when(accountService.getDecryptedSecret(account, SecretField.API_KEY)).thenReturn("bedrock-key");

        UpstreamClient.OutboundRequest request = upstreamClient.buildRequest(
                new RoutedAccount(account, Provider.BEDROCK, "m"), BODY, false);

        assertEquals("https://bedrock-runtime.us-east-1.amazonaws.com/model/m/invoke", request.uri().toString());
    }

    @Test
    void buildRequest_nonObjectBody_badRequest() {
        AccountEntity account = TestAccounts.apiKeyAccount("acc_a");
        byte[] array = "[1,2]".getBytes(StandardCharsets.UTF_8);

        ResponseStatusException error = assertThrows(ResponseStatusException.class, () -> upstreamClient.buildRequest(
                new RoutedAccount(account, Provider.ANTHROPIC, null), array, false));
        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
    }

    @Test
    void forwardAndWrite_copiesStatusAndBodyWithoutHopByHopHeaders() {
        AccountEntity account = TestAccounts.apiKeyAccount("acc_a");
        when(accountService.getDecryptedSecret(account, SecretField.API_KEY)).thenReturn("sk-ant-api03-plain");
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.just(
                ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .header("Connection", "close")
                        .header("request-id", "req_1")
                        .body("{\"type\":\"error\"}")
                        .build()));
        UpstreamClient client = new UpstreamClient(builder, properties, accountService, objectMapper);
        MockServerHttpResponse response = new MockServerHttpResponse();

        StepVerifier.create(client.forwardAndWrite(
                        new RoutedAccount(account, Provider.ANTHROPIC, "m"), BODY, false, response))
                .verifyComplete();

        assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
        assertEquals("req_1", response.getHeaders().getFirst("request-id"));
        assertNull(response.getHeaders().getFirst("Connection"));
        StepVerifier.create(response.getBodyAsString())
                .expectNext("{\"type\":\"error\"}")
                .verifyComplete();
    }
}
