package com.vcc.traingateway.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.exception.AuthenticationException;
import com.vcc.traingateway.exception.ConfigurationException;
import com.vcc.traingateway.model.Provider;
import com.vcc.traingateway.model.RoutedAccount;
import com.vcc.traingateway.model.TenantContext;
import com.vcc.traingateway.model.TenantContextHolder;
import com.vcc.traingateway.service.AccountRouter;
import com.vcc.traingateway.service.UpstreamClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GatewayControllerTest {

  private static final byte[] BODY =
      "{\"model\":\"claude-sonnet-4-5\",\"stream\":true}".getBytes(StandardCharsets.UTF_8);

  @Mock private AccountRouter accountRouter;

  @Mock private UpstreamClient upstreamClient;

  private GatewayController controller;

  @BeforeEach
  void setUp() {
    controller = new GatewayController(accountRouter, upstreamClient, new ObjectMapper());
  }

  private static MockServerWebExchange authenticated(String hint) {
    MockServerHttpRequest.BodyBuilder request = MockServerHttpRequest.post("/v1/messages");
    if (hint != null) {
      request.header(GatewayController.ACCOUNT_HINT_HEADER, hint);
    }
    MockServerWebExchange exchange = MockServerWebExchange.from(request);
    exchange.getAttributes().put(TenantContextHolder.TENANT_ATTR, new TenantContext("t_acme", "key_1"));
    return exchange;
  }

  @Test
  void proxy_routesWithHintAndForwardsStream() {
    AccountEntity account = new AccountEntity();
    account.setAccountId("acc_b");
    RoutedAccount routed = new RoutedAccount(account, Provider.ANTHROPIC, "claude-sonnet-4-5");
    MockServerWebExchange exchange = authenticated("acc_b");
    when(accountRouter.selectAccount("t_acme", "acc_b", "claude-sonnet-4-5")).thenReturn(Mono.just(routed));
    when(upstreamClient.forwardAndWrite(eq(routed), eq(BODY), eq(true), any())).thenReturn(Mono.empty());

    StepVerifier.create(controller.proxy(exchange, BODY)).verifyComplete();
  }

  @Test
  void proxy_routingFailurePropagates() {
    when(accountRouter.selectAccount("t_acme", null, "claude-sonnet-4-5"))
        .thenReturn(Mono.error(ConfigurationException.noUsableAccount("t_acme")));

    StepVerifier.create(controller.proxy(authenticated(null), BODY))
        .expectError(ConfigurationException.class)
        .verify();

    verify(upstreamClient, never()).forwardAndWrite(any(), any(), anyBoolean(), any());
  }

  @Test
  void proxy_withoutTenant_isUnauthenticated() {
    MockServerWebExchange exchange =
        MockServerWebExchange.from(MockServerHttpRequest.post("/v1/messages"));

    StepVerifier.create(controller.proxy(exchange, BODY))
        .expectError(AuthenticationException.class)
        .verify();
  }

  @Test
  void proxy_invalidJson_isBadRequest() {
    byte[] invalid = "not json".getBytes(StandardCharsets.UTF_8);

    assertThrows(
        ResponseStatusException.class, () -> controller.proxy(authenticated(null), invalid));
  }
}
