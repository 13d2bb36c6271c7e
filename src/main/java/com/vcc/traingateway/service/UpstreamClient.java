package com.vcc.traingateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.model.CredentialType;
import com.vcc.traingateway.model.Provider;
import com.vcc.traingateway.model.RoutedAccount;
import com.vcc.traingateway.model.SecretField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds and sends the outbound call for a routed account.
 * The account secret is decrypted here, only for the duration of building the request.
 */
@Service
public class UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(UpstreamClient.class);

    static final String BEDROCK_ANTHROPIC_VERSION = "bedrock-2023-05-31";

    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "transfer-encoding", "upgrade"
    );

    private final WebClient webClient;
    private final GwProperties properties;
    private final AccountService accountService;
    private final ObjectMapper objectMapper;

    public UpstreamClient(WebClient.Builder builder, GwProperties properties,
                          AccountService accountService, ObjectMapper objectMapper) {
        // Disable connection pooling to avoid stale connections
        HttpClient httpClient = HttpClient.create().keepAlive(false);

        this.webClient = builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
        this.properties = properties;
        this.accountService = accountService;
        this.objectMapper = objectMapper;
        log.info("UpstreamClient initialized with baseUrl={}", properties.getUpstreamBaseUrl());
    }

    /**
     * Outbound request ready to send. Headers carry the decrypted credential; never log them.
     */
    record OutboundRequest(URI uri, HttpHeaders headers, byte[] body) {
        @Override
        public String toString() {
            return "OutboundRequest{uri=" + uri + "}";
        }
    }

    /**
     * Forward request to upstream and write response directly to ServerHttpResponse.
     * This ensures the body stream is consumed within the exchange context.
     */
    public Mono<Void> forwardAndWrite(RoutedAccount routed, byte[] body, boolean stream,
                                      ServerHttpResponse response) {
        OutboundRequest outbound;
        try {
            outbound = buildRequest(routed, body, stream);
        } catch (RuntimeException e) {
            return Mono.error(e);
        }
        log.debug("Forwarding to {} via account {} (stream={})", outbound.uri().getHost(),
                routed.account().getAccountId(), stream);

        return webClient
                .post()
                .uri(outbound.uri())
                .headers(headers -> headers.addAll(outbound.headers()))
                .body(BodyInserters.fromValue(outbound.body()))
                .exchangeToMono(clientResponse -> {
                    HttpStatusCode status = clientResponse.statusCode();
                    response.setStatusCode(status);

                    HttpHeaders out = response.getHeaders();
                    clientResponse.headers().asHttpHeaders().forEach((name, values) -> {
                        if (isHopByHop(name)) {
                            return;
                        }
                        out.put(name, new ArrayList<>(values));
                    });

                    if (stream) {
                        out.set(HttpHeaders.CACHE_CONTROL, "no-cache");
                        out.set("X-Accel-Buffering", "no");
                    }
                    if (status.isError()) {
                        log.warn("Upstream returned {} for account {}", status.value(),
                                routed.account().getAccountId());
                    }

                    Flux<DataBuffer> bodyFlux = clientResponse.bodyToFlux(DataBuffer.class)
                            .doOnNext(buf -> log.trace("Received {} bytes", buf.readableByteCount()))
                            .doOnComplete(() -> log.debug("Upstream body completed"))
                            .doOnError(e -> log.error("Upstream body error: {}", e.getMessage()));

                    if (stream) {
                        // Streaming: flush each chunk immediately
                        return response.writeAndFlushWith(bodyFlux.map(Mono::just));
                    }
                    return response.writeWith(bodyFlux);
                });
    }

    OutboundRequest buildRequest(RoutedAccount routed, byte[] body, boolean stream) {
        AccountEntity account = routed.account();
        ObjectNode payload = parseBody(body);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        if (routed.provider() == Provider.BEDROCK) {
            // Model goes in the path, streaming is chosen by the endpoint
            payload.remove("model");
            payload.remove("stream");
            payload.put("anthropic_version", BEDROCK_ANTHROPIC_VERSION);
            headers.setBearerAuth(accountService.getDecryptedSecret(account, SecretField.API_KEY));
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            return new OutboundRequest(bedrockUri(account, routed.upstreamModel(), stream), headers,
                    writeBody(payload));
        }

        if (routed.upstreamModel() != null) {
            payload.put("model", routed.upstreamModel());
        }
        headers.set("anthropic-version", properties.getAnthropicVersion());
        headers.setAccept(List.of(stream ? MediaType.TEXT_EVENT_STREAM : MediaType.APPLICATION_JSON));
        if (account.credentialTypeValue() == CredentialType.OAUTH) {
            headers.setBearerAuth(accountService.getDecryptedSecret(account, SecretField.OAUTH_ACCESS));
            headers.set("anthropic-beta", properties.getOauth().getBetaHeader());
        } else {
            headers.set("x-api-key", accountService.getDecryptedSecret(account, SecretField.API_KEY));
        }
        return new OutboundRequest(URI.create(trimSlash(properties.getUpstreamBaseUrl()) + "/v1/messages"),
                headers, writeBody(payload));
    }

    private URI bedrockUri(AccountEntity account, String model, boolean stream) {
        if (model == null || model.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body has no model");
        }
        String region = account.getRegion() != null ? account.getRegion() : properties.getBedrockDefaultRegion();
        String action = stream ? "invoke-with-response-stream" : "invoke";
        return URI.create("https://bedrock-runtime." + region + ".amazonaws.com/model/"
                + URLEncoder.encode(model, StandardCharsets.UTF_8) + "/" + action);
    }

    private ObjectNode parseBody(byte[] body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body must be a JSON object");
            }
            return ((ObjectNode) root).deepCopy();
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid JSON body", ex);
        }
    }

    private byte[] writeBody(ObjectNode payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to serialize upstream body", ex);
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static boolean isHopByHop(String name) {
        return HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT));
    }
}
