package com.vcc.traingateway.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.dto.ErrorResponse;
import com.vcc.traingateway.exception.AuthenticationException;
import com.vcc.traingateway.exception.AuthorizationException;
import com.vcc.traingateway.model.TenantContext;
import com.vcc.traingateway.model.TenantContextHolder;
import com.vcc.traingateway.service.ClientAuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Authenticates client requests on the protected proxy paths and binds the tenant to the
 * exchange and the Reactor context. Nothing downstream runs for a request that fails here.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ClientAuthFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(ClientAuthFilter.class);

    private final ClientAuthService clientAuthService;
    private final ObjectMapper objectMapper;
    private final List<String> protectedPrefixes;
    private final String challenge;

    public ClientAuthFilter(ClientAuthService clientAuthService, ObjectMapper objectMapper,
                            GwProperties properties) {
        this.clientAuthService = clientAuthService;
        this.objectMapper = objectMapper;
        this.protectedPrefixes = List.copyOf(properties.getAuth().getProtectedPathPrefixes());
        this.challenge = "Bearer realm=\"" + properties.getAuth().getRealm() + "\"";
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!isProtected(path)) {
            return chain.filter(exchange);
        }

        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        return clientAuthService.authenticate(header)
                .onErrorResume(AuthenticationException.class, e -> {
                    log.warn("Rejected client request to {}: {}", path, e.getReason());
                    return unauthorized(exchange, e).then(Mono.<TenantContext>empty());
                })
                .onErrorResume(AuthorizationException.class, e -> {
                    log.warn("Rejected client request to {}: tenant {} is not active", path, e.getTenantId());
                    return forbidden(exchange).then(Mono.<TenantContext>empty());
                })
                .flatMap(tenant -> {
                    exchange.getAttributes().put(TenantContextHolder.TENANT_ATTR, tenant);
                    return chain.filter(exchange)
                            .contextWrite(TenantContextHolder.withTenant(tenant));
                });
    }

    private boolean isProtected(String path) {
        for (String prefix : protectedPrefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange, AuthenticationException e) {
        ServerHttpResponse response = exchange.getResponse();
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, challenge);
        return write(response, HttpStatus.UNAUTHORIZED,
                ErrorResponse.of("authentication_error", e.getReason().clientMessage()));
    }

    private Mono<Void> forbidden(ServerWebExchange exchange) {
        return write(exchange.getResponse(), HttpStatus.FORBIDDEN,
                ErrorResponse.of("permission_error", "Tenant is not active"));
    }

    private Mono<Void> write(ServerHttpResponse response, HttpStatus status, ErrorResponse body) {
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException ex) {
            return Mono.error(ex);
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }
}
