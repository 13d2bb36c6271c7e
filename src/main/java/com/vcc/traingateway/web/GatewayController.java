package com.vcc.traingateway.web;

import com.vcc.traingateway.exception.AuthenticationException;
import com.vcc.traingateway.model.TenantContext;
import com.vcc.traingateway.model.TenantContextHolder;
import com.vcc.traingateway.service.AccountRouter;
import com.vcc.traingateway.service.UpstreamClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
public class GatewayController {
  private static final Logger log = LoggerFactory.getLogger(GatewayController.class);

  static final String ACCOUNT_HINT_HEADER = "MSL-Account";

  private final AccountRouter accountRouter;
  private final UpstreamClient upstreamClient;
  private final ObjectMapper objectMapper;

  public GatewayController(
      AccountRouter accountRouter, UpstreamClient upstreamClient, ObjectMapper objectMapper) {
    this.accountRouter = accountRouter;
    this.upstreamClient = upstreamClient;
    this.objectMapper = objectMapper;
  }

  @PostMapping(path = "/v1/messages", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Mono<Void> proxy(ServerWebExchange exchange, @RequestBody byte[] body) {
    TenantContext tenant = exchange.getAttribute(TenantContextHolder.TENANT_ATTR);
    if (tenant == null) {
      // Filter not applied to this path
      return Mono.error(new AuthenticationException(AuthenticationException.Reason.MISSING));
    }
    String requestId = UUID.randomUUID().toString();
    JsonNode root = parse(body);
    boolean stream = isStream(root);
    String model = root.hasNonNull("model") ? root.get("model").asText() : null;
    String hint = exchange.getRequest().getHeaders().getFirst(ACCOUNT_HINT_HEADER);
    ServerHttpResponse response = exchange.getResponse();

    return accountRouter
        .selectAccount(tenant.tenantId(), hint, model)
        .flatMap(
            routed -> {
              log.debug(
                  "requestId={} tenantId={} accountId={} model={}",
                  requestId,
                  tenant.tenantId(),
                  routed.account().getAccountId(),
                  routed.upstreamModel());
              return upstreamClient.forwardAndWrite(routed, body, stream, response);
            })
        .doOnTerminate(
            () ->
                log.info(
                    "requestId={} tenantId={} stream={} status={}",
                    requestId,
                    tenant.tenantId(),
                    stream,
                    response.getStatusCode() != null ? response.getStatusCode().value() : "n/a"))
        .contextWrite(TenantContextHolder.withTenant(tenant));
  }

  private JsonNode parse(byte[] body) {
    try {
      JsonNode root = objectMapper.readTree(body);
      if (root == null || !root.isObject()) {
        throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body must be a JSON object");
      }
      return root;
    } catch (IOException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid JSON body", ex);
    }
  }

  private boolean isStream(JsonNode root) {
    JsonNode streamNode = root.get("stream");
    return streamNode != null && streamNode.isBoolean() && streamNode.booleanValue();
  }
}
