package com.vcc.traingateway.service;

import com.vcc.traingateway.exception.AuthenticationException;
import com.vcc.traingateway.exception.AuthorizationException;
import com.vcc.traingateway.model.TenantContext;
import com.vcc.traingateway.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an {@code Authorization} header into the tenant it authenticates.
 */
@Service
public class ClientAuthService {
    private static final Logger log = LoggerFactory.getLogger(ClientAuthService.class);

    private static final Pattern BEARER = Pattern.compile("^Bearer\\s+(.+)$", Pattern.CASE_INSENSITIVE);

    private final ClientKeyService clientKeyService;
    private final TenantRepository tenantRepository;

    public ClientAuthService(ClientKeyService clientKeyService, TenantRepository tenantRepository) {
        this.clientKeyService = clientKeyService;
        this.tenantRepository = tenantRepository;
    }

    /**
     * Errors with {@link AuthenticationException} for a missing, malformed or unknown token and
     * with {@link AuthorizationException} when the owning tenant is gone or inactive.
     */
    public Mono<TenantContext> authenticate(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Mono.error(new AuthenticationException(AuthenticationException.Reason.MISSING));
        }
        String token = extractBearerToken(authorizationHeader);
        if (token == null) {
            return Mono.error(new AuthenticationException(AuthenticationException.Reason.MALFORMED));
        }

        return clientKeyService.verifyClientKey(token)
                .switchIfEmpty(Mono.error(() -> new AuthenticationException(AuthenticationException.Reason.INVALID)))
                .flatMap(info -> tenantRepository.findById(info.tenantId())
                        .filter(tenant -> tenant.isActive())
                        .switchIfEmpty(Mono.error(() -> {
                            log.warn("Client key {} belongs to missing or inactive tenant {}",
                                    info.keyId(), info.tenantId());
                            return AuthorizationException.tenantInactive(info.tenantId());
                        }))
                        .map(tenant -> new TenantContext(tenant.getTenantId(), info.keyId())));
    }

    static String extractBearerToken(String header) {
        Matcher matcher = BEARER.matcher(header.trim());
        if (!matcher.matches()) {
            return null;
        }
        String token = matcher.group(1).trim();
        return token.isEmpty() ? null : token;
    }
}
