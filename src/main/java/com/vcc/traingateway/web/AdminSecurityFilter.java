package com.vcc.traingateway.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Guards the management surface under {@code /admin}.
 * Validates the configured admin key header and records the caller as the audit actor.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AdminSecurityFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(AdminSecurityFilter.class);

    static final String ADMIN_PATH_PREFIX = "/admin";
    static final String ADMIN_ACTOR_ATTR = "adminActor";

    private final String apiKeyHeader;
    private final List<byte[]> adminApiKeys;
    private final ObjectMapper objectMapper;

    public AdminSecurityFilter(GwProperties properties, ObjectMapper objectMapper) {
        GwProperties.AdminConfig adminConfig = properties.getAdmin();
        this.apiKeyHeader = adminConfig.getApiKeyHeader() != null
                ? adminConfig.getApiKeyHeader()
                : "X-Admin-Api-Key";
        this.adminApiKeys = adminConfig.getAdminApiKeys() == null
                ? List.of()
                : adminConfig.getAdminApiKeys().stream()
                        .filter(key -> key != null && !key.isBlank())
                        .map(key -> key.getBytes(StandardCharsets.UTF_8))
                        .toList();
        this.objectMapper = objectMapper;

        if (adminApiKeys.isEmpty()) {
            log.warn("No admin API keys configured - admin endpoints will be inaccessible");
        } else {
            log.info("AdminSecurityFilter configured with {} admin keys", adminApiKeys.size());
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!path.startsWith(ADMIN_PATH_PREFIX)) {
            return chain.filter(exchange);
        }

        if (adminApiKeys.isEmpty()) {
            return unauthorized(exchange, "Admin API not configured");
        }

        String providedKey = exchange.getRequest().getHeaders().getFirst(apiKeyHeader);
        if (providedKey == null || providedKey.isBlank()) {
            return unauthorized(exchange, "Missing " + apiKeyHeader + " header");
        }

        if (!isAdminKey(providedKey)) {
            log.warn("Invalid admin API key from {}", exchange.getRequest().getRemoteAddress());
            return unauthorized(exchange, "Invalid admin API key");
        }

        String actor = "admin:" + maskKey(providedKey);
        exchange.getAttributes().put(ADMIN_ACTOR_ATTR, actor);

        log.debug("Admin request authenticated: {} {}", actor, path);
        return chain.filter(exchange);
    }

    private boolean isAdminKey(String providedKey) {
        byte[] provided = providedKey.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] key : adminApiKeys) {
            match |= MessageDigest.isEqual(key, provided);
        }
        return match;
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(ErrorResponse.of("authentication_error", message));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        return exchange.getResponse().writeWith(
                Mono.just(exchange.getResponse().bufferFactory().wrap(bytes))
        );
    }

    /**
     * Mask API key for logging (show first 8 chars).
     */
    private String maskKey(String key) {
        if (key.length() < 8) {
            return "****";
        }
        return key.substring(0, 8) + "...";
    }
}
